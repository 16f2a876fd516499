package br.com.coursesync.api.service.sync;

import br.com.coursesync.api.exception.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionSystemException;

import java.sql.SQLException;
import java.util.function.Supplier;

/**
 * Executa chamadas ao banco com novas tentativas e backoff exponencial
 * quando o banco está travado ou indisponível.
 *
 * <p>A ação deve abrir a própria transação: depois de um erro de banco a transação
 * corrente fica marcada para rollback e não pode ser reaproveitada.
 *
 * <p>Se o pool descarta a conexão junto com o erro transitório, o rollback falha e o erro
 * original some atrás da falha do rollback: {@link TransactionSystemException} com o erro como
 * exceção da aplicação, ou um erro cuja causa é a conexão fechada (SQLSTATE classe 08).
 * A transação não chegou ao banco nesses casos, então a chamada também é repetida.
 */
@Component
public class StorageRetryTemplate {

    private static final Logger logger = LoggerFactory.getLogger(StorageRetryTemplate.class);

    private final int maxAttempts;
    private final long initialBackoffMs;
    private final double multiplier;

    public StorageRetryTemplate(@Value("${coursesync.storage.retry.max-attempts:3}") int maxAttempts,
                                @Value("${coursesync.storage.retry.initial-backoff-ms:200}") long initialBackoffMs,
                                @Value("${coursesync.storage.retry.multiplier:2.0}") double multiplier) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("max-attempts deve ser >= 1: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoffMs = Math.max(0, initialBackoffMs);
        this.multiplier = Math.max(1.0, multiplier);
    }

    public <T> T execute(String description, Supplier<T> action) {
        int attempt = 0;
        long waitTime = initialBackoffMs;
        TransientDataAccessException lastException = null;

        while (attempt < maxAttempts) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                TransientDataAccessException transientError = transientCause(e);
                if (transientError == null) {
                    throw e;
                }
                attempt++;
                lastException = transientError;

                if (attempt < maxAttempts) {
                    logger.warn("Banco indisponível em '{}' (tentativa {}/{}), nova tentativa em {}ms: {}",
                            description, attempt, maxAttempts, waitTime, transientError.getMessage());
                    sleep(waitTime);
                    waitTime = (long) (waitTime * multiplier);
                }
            }
        }

        throw new StorageUnavailableException(
                "Falha em '" + description + "' após " + maxAttempts + " tentativas", lastException);
    }

    private static TransientDataAccessException transientCause(RuntimeException e) {
        if (e instanceof TransientDataAccessException) {
            return (TransientDataAccessException) e;
        }
        if (e instanceof TransactionSystemException
                && ((TransactionSystemException) e).getApplicationException() instanceof TransientDataAccessException) {
            return (TransientDataAccessException) ((TransactionSystemException) e).getApplicationException();
        }
        for (Throwable cause = e.getCause(); cause != null && cause != cause.getCause(); cause = cause.getCause()) {
            if (cause instanceof SQLException && isConnectionFailure((SQLException) cause)) {
                return new TransientDataAccessResourceException("Conexão perdida: " + cause.getMessage(), e);
            }
        }
        return null;
    }

    private static boolean isConnectionFailure(SQLException e) {
        return e.getSQLState() != null && e.getSQLState().startsWith("08");
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    private void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new StorageUnavailableException("Interrompido durante nova tentativa", ie);
        }
    }
}
