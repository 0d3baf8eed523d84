package buzzscope.model.service.monitor;

import buzzscope.model.domain.NotificationEvent;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/** Appends one JSON object per event to a file. Absent post fields are written as null. */
public final class JsonlNotificationSink implements NotificationSink {
    private static final Gson GSON = new GsonBuilder()
            .disableHtmlEscaping()
            .serializeNulls()
            .create();

    private final Path file;

    public JsonlNotificationSink(Path file) { this.file = file; }

    public Path path() { return file; }

    @Override public synchronized void deliver(NotificationEvent event) throws IOException {
        Path dir = file.toAbsolutePath().getParent();
        if (dir != null) Files.createDirectories(dir);
        try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            w.write(toJson(event));
            w.newLine();
        }
    }

    static String toJson(NotificationEvent event) {
        return GSON.toJson(event);
    }
}
