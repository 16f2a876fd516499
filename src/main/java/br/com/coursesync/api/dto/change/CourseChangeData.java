package br.com.coursesync.api.dto.change;

public record CourseChangeData(
        String name,
        String courseOutline
) implements ChangeData {
}
