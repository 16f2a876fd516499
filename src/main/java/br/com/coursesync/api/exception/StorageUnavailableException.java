package br.com.coursesync.api.exception;

// Banco indisponível ou travado mesmo após as novas tentativas
public class StorageUnavailableException extends RuntimeException {
    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
