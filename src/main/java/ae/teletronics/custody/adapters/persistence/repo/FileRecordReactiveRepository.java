package ae.teletronics.custody.adapters.persistence.repo;

import ae.teletronics.custody.domain.model.FileRecord;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;

public interface FileRecordReactiveRepository extends ReactiveMongoRepository<FileRecord, String> {
}
