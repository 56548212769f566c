package com.gatekeeper.auth.data;

import com.gatekeeper.auth.exception.ErrorKind;
import com.gatekeeper.auth.exception.ServiceException;

import java.util.Optional;

/**
 * Outcome of one executor call: either committed rows or a rolled-back
 * {@link StorageFailure}. A failed statement is never reported as "no rows".
 */
public final class QueryResult {

    private final Rows rows;
    private final int updateCount;
    private final StorageFailure failure;

    private QueryResult(Rows rows, int updateCount, StorageFailure failure) {
        this.rows = rows;
        this.updateCount = updateCount;
        this.failure = failure;
    }

    public static QueryResult success(Rows rows, int updateCount) {
        return new QueryResult(rows, updateCount, null);
    }

    public static QueryResult failure(StorageFailure failure) {
        return new QueryResult(Rows.none(), 0, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public boolean isFailure() {
        return failure != null;
    }

    /** Fetched rows; {@link Rows#none()} when nothing was fetched or the call failed. */
    public Rows rows() {
        return rows;
    }

    /** Rows affected by a statement that produced no result set, otherwise 0. */
    public int updateCount() {
        return updateCount;
    }

    public Optional<StorageFailure> failure() {
        return Optional.ofNullable(failure);
    }

    /**
     * Rows of a successful call.
     *
     * @throws ServiceException STORAGE_FAILURE when the statement failed
     */
    public Rows orThrow() {
        if (failure != null) {
            throw new ServiceException(ErrorKind.STORAGE_FAILURE,
                    "Storage operation failed: " + failure.message(), failure.cause());
        }
        return rows;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "QueryResult[success, " + rows + ", updateCount=" + updateCount + "]"
                : "QueryResult[failure, " + failure.message() + "]";
    }
}
