package br.com.coursesync.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CourseSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(CourseSyncApplication.class, args);
    }

}
