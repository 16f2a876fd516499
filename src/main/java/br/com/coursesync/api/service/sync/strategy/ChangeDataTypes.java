package br.com.coursesync.api.service.sync.strategy;

import br.com.coursesync.api.dto.change.ChangeData;
import br.com.coursesync.api.exception.InvalidChangeDataTypeException;

final class ChangeDataTypes {

    private ChangeDataTypes() {
    }

    static <T extends ChangeData> T require(ChangeData data, Class<T> expected, String operation) {
        if (!expected.isInstance(data)) {
            throw new InvalidChangeDataTypeException(
                    expected.getSimpleName(),
                    data == null ? "null" : data.getClass().getSimpleName(),
                    operation);
        }
        return expected.cast(data);
    }
}
