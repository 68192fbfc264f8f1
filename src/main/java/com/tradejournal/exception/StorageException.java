package com.tradejournal.exception;

/**
 * Thrown when the trade record store fails to query, insert or delete.
 *
 * <p>The message carries the store's own error text so callers can show it verbatim.
 * An import that hits this exception has written nothing: the insert is a single transaction.
 */
public class StorageException extends BaseException {

    public StorageException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_ERROR, message, cause);
    }
}
