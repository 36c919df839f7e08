package com.phillippitts.consulttranslator.service.recording;

import com.phillippitts.consulttranslator.config.properties.RecordingProperties;
import com.phillippitts.consulttranslator.domain.ConversationEntry;
import com.phillippitts.consulttranslator.domain.ConversationTranscript;
import com.phillippitts.consulttranslator.exception.RecordingException;
import com.phillippitts.consulttranslator.exception.RecordingNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Saves finished conversations as JSON files and reads them back.
 *
 * <p>Each conversation produces three files sharing a minute-resolution stamp:
 * <ul>
 *   <li>{@code <prefix>-Orig_Lang_<stamp>.json} - Original view with every entry</li>
 *   <li>{@code <prefix>-<PRIMARY>_<stamp>.json} - primary party's view</li>
 *   <li>{@code <prefix>-<SECONDARY>_<stamp>.json} - secondary party's view</li>
 * </ul>
 * When a file with the same stamp already exists a numeric suffix is added instead of
 * overwriting it.
 */
@Component
public class ConversationRecorder {

    private static final Logger LOG = LogManager.getLogger(ConversationRecorder.class);

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("MMddyyyy_HH_mm");
    private static final Pattern SAFE_FILE_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*\\.json");
    private static final int JSON_INDENT = 2;

    private final RecordingProperties props;
    private final Path directory;
    private final Clock clock;

    @Autowired
    public ConversationRecorder(RecordingProperties props) {
        this(props, Clock.systemDefaultZone());
    }

    ConversationRecorder(RecordingProperties props, Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.directory = Paths.get(props.getDirectory());
    }

    /**
     * Writes the three files of a conversation.
     *
     * @param transcript finished conversation
     * @return paths of the written files
     * @throws RecordingException if the directory or a file cannot be written
     */
    public RecordedConversation save(ConversationTranscript transcript) {
        Objects.requireNonNull(transcript, "transcript must not be null");
        ensureDirectory();

        LocalDateTime now = LocalDateTime.now(clock);
        String stamp = uniqueStamp(now.format(FILE_STAMP), transcript);
        String savedAt = now.toString();

        JSONObject original = new JSONObject()
                .put("timestamp", savedAt)
                .put("conversation_id", transcript.conversationId())
                .put("type", "original")
                .put("language", "mixed")
                .put("primary_language", transcript.primaryLanguage())
                .put("secondary_language", transcript.secondaryLanguage())
                .put("entries", toJson(transcript.entries()))
                .put("full_text", transcript.originalText());
        JSONObject primary = viewDocument(savedAt, transcript, "doctor_view",
                transcript.primaryLanguage(), transcript.primaryEntries(), transcript.primaryText());
        JSONObject secondary = viewDocument(savedAt, transcript, "patient_view",
                transcript.secondaryLanguage(), transcript.secondaryEntries(), transcript.secondaryText());

        RecordedConversation recorded = new RecordedConversation(
                write(originalFile(stamp), original),
                write(viewFile(transcript, true, stamp), primary),
                write(viewFile(transcript, false, stamp), secondary));
        LOG.info("Conversation {} saved: {}", transcript.conversationId(), recorded.files());
        return recorded;
    }

    /**
     * Lists saved recording file names, sorted.
     *
     * @throws RecordingException if the directory cannot be read
     */
    public List<String> list() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        String prefix = props.getFilePrefix() + "-";
        try (Stream<Path> files = Files.list(directory)) {
            return files.map(p -> p.getFileName().toString())
                    .filter(name -> name.startsWith(prefix) && name.endsWith(".json"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new RecordingException("Failed to list recordings", directory.toString(), e);
        }
    }

    /**
     * Reads one recording by file name.
     *
     * @param fileName bare file name as returned by {@link #list()}
     * @return raw JSON content
     * @throws IllegalArgumentException    if the name is not a plain recording file name
     * @throws RecordingNotFoundException  if no such recording exists
     * @throws RecordingException          if the file cannot be read
     */
    public String load(String fileName) {
        if (fileName == null || !SAFE_FILE_NAME.matcher(fileName).matches() || fileName.contains("..")) {
            throw new IllegalArgumentException("Invalid recording name: " + fileName);
        }
        Path file = directory.resolve(fileName);
        if (!Files.isRegularFile(file)) {
            throw new RecordingNotFoundException(fileName);
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RecordingException("Failed to read recording", file.toString(), e);
        }
    }

    public Path directory() {
        return directory;
    }

    private JSONObject viewDocument(String savedAt, ConversationTranscript transcript, String type,
                                    String language, List<ConversationEntry> entries, String fullText) {
        return new JSONObject()
                .put("timestamp", savedAt)
                .put("conversation_id", transcript.conversationId())
                .put("type", type)
                .put("language", language)
                .put("entries", toJson(entries))
                .put("full_text", fullText);
    }

    private static JSONArray toJson(List<ConversationEntry> entries) {
        JSONArray array = new JSONArray();
        for (ConversationEntry entry : entries) {
            array.put(new JSONObject()
                    .put("timestamp", entry.timestamp())
                    .put("speaker", entry.speaker())
                    .put("text", entry.text())
                    .put("language", entry.language())
                    .put("translation_status", entry.status())
                    .put("view", entry.view()));
        }
        return array;
    }

    private void ensureDirectory() {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new RecordingException("Failed to create recordings directory", directory.toString(), e);
        }
    }

    private String uniqueStamp(String base, ConversationTranscript transcript) {
        String stamp = base;
        int attempt = 1;
        while (Files.exists(originalFile(stamp))
                || Files.exists(viewFile(transcript, true, stamp))
                || Files.exists(viewFile(transcript, false, stamp))) {
            attempt++;
            stamp = base + "_" + attempt;
        }
        return stamp;
    }

    private Path originalFile(String stamp) {
        return directory.resolve(props.getFilePrefix() + "-Orig_Lang_" + stamp + ".json");
    }

    /**
     * Per-party file named by language code. When both parties share a language the role is
     * added so the two views get distinct files.
     */
    private Path viewFile(ConversationTranscript transcript, boolean primaryView, String stamp) {
        String language = primaryView ? transcript.primaryLanguage() : transcript.secondaryLanguage();
        String code = language.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9-]", "");
        if (transcript.primaryLanguage().equalsIgnoreCase(transcript.secondaryLanguage())) {
            code += primaryView ? "-doctor" : "-patient";
        }
        return directory.resolve(props.getFilePrefix() + "-" + code + "_" + stamp + ".json");
    }

    private static Path write(Path file, JSONObject document) {
        try {
            return Files.writeString(file, document.toString(JSON_INDENT), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RecordingException("Failed to write recording", file.toString(), e);
        }
    }
}
