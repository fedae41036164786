package ae.teletronics.custody.adapters.persistence.repo;

import ae.teletronics.custody.domain.model.UserRecord;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;

public interface UserRecordReactiveRepository extends ReactiveMongoRepository<UserRecord, String> {
}
