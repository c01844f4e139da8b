package com.gridplanner.dispatch.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.gridplanner.core.model.Task;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads already-validated task records from a JSON array and writes layout results as JSON.
 */
@Component
public class TaskFileReader {

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);

    public List<Task> read(Path file) throws IOException {
        List<Task> tasks = mapper.readValue(file.toFile(), new TypeReference<List<Task>>() {});
        for (Task task : tasks) {
            if (task.id() == null || task.startDate() == null || task.endDate() == null) {
                throw new IOException("Task record without id or dates in " + file);
            }
            if (task.endDate().isBefore(task.startDate())) {
                throw new IOException("Task " + task.id() + " ends before it starts");
            }
        }
        return tasks;
    }

    public String toJson(Object value) throws IOException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
    }
}
