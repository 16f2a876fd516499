package br.com.coursesync.api.model.enums;

public enum EntityType {
    COURSE,
    TOPIC,
    SUBTOPIC
}
