package ae.teletronics.custody.application.util;

import com.mongodb.MongoException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;

/**
 * Tells a lost write race apart from other store failures.
 * <p>
 * Spring Data MongoDB translates a server WriteConflict (code 112, labelled
 * {@code TransientTransactionError}) into a generic {@code UncategorizedMongoDbException}
 * or {@code DataIntegrityViolationException}, so the translated type alone says
 * nothing. The driver exception in the cause chain does.
 */
public final class WriteConflicts {

    static final int WRITE_CONFLICT_CODE = 112;

    private WriteConflicts() {}

    public static boolean isWriteConflict(Throwable error) {
        if (error instanceof DuplicateKeyException) {
            return false; // id collision, handled by IdCollisionRetry
        }
        for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof TransientDataAccessException) {
                return true;
            }
            if (t instanceof MongoException mongo
                    && (mongo.getCode() == WRITE_CONFLICT_CODE
                    || mongo.hasErrorLabel(MongoException.TRANSIENT_TRANSACTION_ERROR_LABEL))) {
                return true;
            }
        }
        return false;
    }
}
