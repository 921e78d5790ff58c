package com.openstay.common.result;

import com.openstay.common.exception.BusinessException;
import com.openstay.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;

import java.util.function.Supplier;

/**
 * Boundary between transactional code, which signals failure by throwing so that Spring rolls back,
 * and callers, which receive a tagged {@link OperationResult}.
 *
 * The supplier must be a call through a transactional proxy: by the time an exception reaches this
 * boundary the transaction has already been rolled back.
 */
@Slf4j
public final class Operations {

    private Operations() {
        // Utility class
    }

    public static <T> OperationResult<T> capture(String operation, Supplier<T> action) {
        try {
            return OperationResult.success(action.get());
        } catch (BusinessException ex) {
            log.warn("{} rejected [{}]: {}", operation, ex.getErrorCode().getTag(), ex.getMessage());
            return OperationResult.failure(ex.getErrorCode(), ex.getMessage());
        } catch (DataAccessException | TransactionException ex) {
            log.error("{} failed in persistence, changes rolled back", operation, ex);
            return OperationResult.failure(ErrorCode.PERSISTENCE_FAILURE,
                    operation + " could not be completed");
        }
    }
}
