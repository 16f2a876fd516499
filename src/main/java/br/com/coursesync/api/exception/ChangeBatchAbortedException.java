package br.com.coursesync.api.exception;

import br.com.coursesync.api.dto.change.ChangeOperation;

// Lançada no modo STRICT para desfazer o lote inteiro
public class ChangeBatchAbortedException extends RuntimeException {

    private final transient ChangeOperation failedChange;

    public ChangeBatchAbortedException(ChangeOperation failedChange, Throwable cause) {
        super("Lote abortado na operação " + failedChange.describe(), cause);
        this.failedChange = failedChange;
    }

    public ChangeOperation getFailedChange() {
        return failedChange;
    }
}
