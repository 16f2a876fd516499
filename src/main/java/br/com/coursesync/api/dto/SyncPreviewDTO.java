package br.com.coursesync.api.dto;

import br.com.coursesync.api.dto.change.ChangeOperation;

import java.util.List;

public record SyncPreviewDTO(
        String courseId,
        boolean firstSync,
        List<ChangeOperation> changes
) {
}
