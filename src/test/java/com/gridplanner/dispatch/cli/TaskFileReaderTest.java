package com.gridplanner.dispatch.cli;

import com.gridplanner.core.model.Task;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskFileReaderTest {

    private final TaskFileReader reader = new TaskFileReader();

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("reads task records with ISO dates")
    void readsSample() throws IOException, URISyntaxException {
        Path sample = Path.of(getClass().getResource("/tasks-sample.json").toURI());

        List<Task> tasks = reader.read(sample);

        assertEquals(4, tasks.size());
        Task imaging = tasks.get(2);
        assertEquals("T-003", imaging.id());
        assertEquals(LocalDate.of(2024, 1, 28), imaging.startDate());
        assertEquals(LocalDate.of(2024, 2, 3), imaging.endDate());
        assertEquals("Alex", imaging.assignee());
        assertTrue(tasks.get(3).isMilestone());
        assertEquals(5, tasks.get(3).priority());
    }

    @Test
    @DisplayName("ignores unknown properties")
    void unknownProperties() throws IOException {
        Path file = tempDir.resolve("tasks.json");
        Files.writeString(file, """
                [{"id": "T-1", "startDate": "2024-03-01", "endDate": "2024-03-02", "priority": 2, "color": "red"}]
                """);

        List<Task> tasks = reader.read(file);

        assertEquals(1, tasks.size());
        assertNull(tasks.get(0).category());
    }

    @Test
    @DisplayName("rejects a record without dates")
    void missingDates() throws IOException {
        Path file = tempDir.resolve("tasks.json");
        Files.writeString(file, "[{\"id\": \"T-1\", \"priority\": 2}]");

        IOException e = assertThrows(IOException.class, () -> reader.read(file));
        assertTrue(e.getMessage().contains("without id or dates"));
    }

    @Test
    @DisplayName("writes dates as ISO strings")
    void toJson() throws IOException {
        Task task = new Task("T-1", "Draft", "ADMIN", "", LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 2),
                2, "Planned", "Sam");

        String json = reader.toJson(task);

        assertTrue(json.contains("\"startDate\" : \"2024-03-01\""));
        assertTrue(json.contains("\"id\" : \"T-1\""));
    }
}
