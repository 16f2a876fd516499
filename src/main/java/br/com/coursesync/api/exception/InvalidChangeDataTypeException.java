package br.com.coursesync.api.exception;

/**
 * O payload de uma operação não corresponde ao tipo de entidade.
 * Indica bug na transformação, por isso nunca é tratado por operação.
 */
public class InvalidChangeDataTypeException extends RuntimeException {

    private final String expectedType;
    private final String actualType;

    public InvalidChangeDataTypeException(String expectedType, String actualType, String operation) {
        super("Tipo de dado inválido ao " + operation + ": esperado " + expectedType + ", recebido " + actualType);
        this.expectedType = expectedType;
        this.actualType = actualType;
    }

    public String getExpectedType() {
        return expectedType;
    }

    public String getActualType() {
        return actualType;
    }
}
