package io.indexlist.core;

public class IndexListException extends RuntimeException {

    public IndexListException(Throwable cause) {
        super(cause);
    }

    public IndexListException(String message, Throwable cause) {
        super(message, cause);
    }

    public IndexListException(String message) {
        super(message);
    }

}
