package com.phillippitts.consulttranslator.service.recording;

import com.phillippitts.consulttranslator.config.properties.RecordingProperties;
import com.phillippitts.consulttranslator.domain.ConversationTranscript;
import com.phillippitts.consulttranslator.domain.Token;
import com.phillippitts.consulttranslator.exception.RecordingException;
import com.phillippitts.consulttranslator.exception.RecordingNotFoundException;
import com.phillippitts.consulttranslator.service.router.ConversationRouter;
import com.phillippitts.consulttranslator.service.router.RouterSettings;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversationRecorderTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2026-10-19T14:05:30Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private Path recordings;
    private ConversationRecorder recorder;

    @BeforeEach
    void setUp() {
        recordings = tempDir.resolve("recordings");
        recorder = new ConversationRecorder(new RecordingProperties(true, recordings.toString(), "Doc-patient"), FIXED);
    }

    private static ConversationTranscript transcript() {
        ConversationRouter router = new ConversationRouter(RouterSettings.DEFAULT, "en", "te");
        router.processToken(Token.of("Hello.", "A", "en", true));
        router.processToken(Token.of("నమస్తే.", "B", "te", true));
        return router.transcript("conv-1");
    }

    @Test
    void shouldWriteThreeFilesStampedToTheMinute() {
        RecordedConversation saved = recorder.save(transcript());

        assertThat(saved.original().getFileName().toString()).isEqualTo("Doc-patient-Orig_Lang_10192026_14_05.json");
        assertThat(saved.primary().getFileName().toString()).isEqualTo("Doc-patient-EN_10192026_14_05.json");
        assertThat(saved.secondary().getFileName().toString()).isEqualTo("Doc-patient-TE_10192026_14_05.json");
        assertThat(saved.files()).allSatisfy(path -> assertThat(path).exists());
    }

    @Test
    void shouldWriteOriginalDocument() throws IOException {
        RecordedConversation saved = recorder.save(transcript());

        JSONObject json = new JSONObject(Files.readString(saved.original(), StandardCharsets.UTF_8));
        assertThat(json.getString("type")).isEqualTo("original");
        assertThat(json.getString("language")).isEqualTo("mixed");
        assertThat(json.getString("conversation_id")).isEqualTo("conv-1");
        assertThat(json.getString("primary_language")).isEqualTo("en");
        assertThat(json.getString("secondary_language")).isEqualTo("te");
        assertThat(json.getJSONArray("entries").length()).isEqualTo(4);
        assertThat(json.getString("full_text")).isEqualTo("[Doctor]: Hello.\n[Patient]: నమస్తే.");
    }

    @Test
    void shouldWritePartyViewDocuments() throws IOException {
        RecordedConversation saved = recorder.save(transcript());

        JSONObject doctor = new JSONObject(Files.readString(saved.primary(), StandardCharsets.UTF_8));
        JSONObject patient = new JSONObject(Files.readString(saved.secondary(), StandardCharsets.UTF_8));

        assertThat(doctor.getString("type")).isEqualTo("doctor_view");
        assertThat(doctor.getString("language")).isEqualTo("en");
        assertThat(doctor.getString("full_text")).isEqualTo("[Doctor]: Hello.");
        JSONObject entry = doctor.getJSONArray("entries").getJSONObject(0);
        assertThat(entry.getString("speaker")).isEqualTo("Doctor");
        assertThat(entry.getString("text")).isEqualTo("Hello.");
        assertThat(entry.getString("translation_status")).isEqualTo("original");
        assertThat(entry.getString("view")).isEqualTo("doctor");

        assertThat(patient.getString("type")).isEqualTo("patient_view");
        assertThat(patient.getString("full_text")).isEqualTo("[Patient]: నమస్తే.");
    }

    @Test
    void shouldKeepBothViewsWhenPartiesShareLanguage() throws IOException {
        ConversationRouter router = new ConversationRouter(RouterSettings.DEFAULT, "en", "en");
        router.processToken(Token.of("How are you?", null, "en", true));
        router.processToken(Token.of("Fine, thanks.", null, "en", true));

        RecordedConversation saved = recorder.save(router.transcript("conv-2"));

        assertThat(saved.primary().getFileName().toString()).isEqualTo("Doc-patient-EN-doctor_10192026_14_05.json");
        assertThat(saved.secondary().getFileName().toString()).isEqualTo("Doc-patient-EN-patient_10192026_14_05.json");
        assertThat(saved.files()).doesNotHaveDuplicates().allSatisfy(path -> assertThat(path).exists());

        JSONObject doctor = new JSONObject(Files.readString(saved.primary(), StandardCharsets.UTF_8));
        JSONObject patient = new JSONObject(Files.readString(saved.secondary(), StandardCharsets.UTF_8));
        assertThat(doctor.getString("type")).isEqualTo("doctor_view");
        assertThat(doctor.getString("full_text")).isEqualTo("[Doctor]: How are you?");
        assertThat(patient.getString("type")).isEqualTo("patient_view");
        assertThat(patient.getString("full_text")).isEqualTo("[Patient]: Fine, thanks.");
        assertThat(recorder.list()).hasSize(3);
    }

    @Test
    void shouldNotOverwriteConversationSavedInSameMinute() {
        RecordedConversation first = recorder.save(transcript());
        RecordedConversation second = recorder.save(transcript());

        assertThat(second.original().getFileName().toString()).isEqualTo("Doc-patient-Orig_Lang_10192026_14_05_2.json");
        assertThat(first.original()).exists();
        assertThat(recorder.list()).hasSize(6);
    }

    @Test
    void shouldListOnlyRecordingFilesSorted() throws IOException {
        recorder.save(transcript());
        Files.writeString(recordings.resolve("notes.txt"), "ignore me");
        Files.writeString(recordings.resolve("other.json"), "{}");

        assertThat(recorder.list()).containsExactly(
                "Doc-patient-EN_10192026_14_05.json",
                "Doc-patient-Orig_Lang_10192026_14_05.json",
                "Doc-patient-TE_10192026_14_05.json");
    }

    @Test
    void shouldListNothingBeforeFirstSave() {
        assertThat(recorder.list()).isEmpty();
    }

    @Test
    void shouldLoadSavedRecording() {
        recorder.save(transcript());

        String content = recorder.load("Doc-patient-EN_10192026_14_05.json");

        assertThat(content).contains("doctor_view");
    }

    @Test
    void shouldRejectPathTraversal() {
        assertThatThrownBy(() -> recorder.load("../secret.json"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> recorder.load("sub/dir.json"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> recorder.load(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldReportMissingRecording() {
        assertThatThrownBy(() -> recorder.load("Doc-patient-EN_01012020_00_00.json"))
                .isInstanceOf(RecordingNotFoundException.class)
                .hasMessageContaining("Doc-patient-EN_01012020_00_00.json");
    }

    @Test
    void shouldWrapIoFailuresWithPath() throws IOException {
        Path blocked = Files.writeString(tempDir.resolve("blocked"), "not a directory");
        ConversationRecorder broken = new ConversationRecorder(
                new RecordingProperties(true, blocked.toString(), "Doc-patient"), FIXED);

        assertThatThrownBy(() -> broken.save(transcript()))
                .isInstanceOf(RecordingException.class)
                .satisfies(ex -> assertThat(((RecordingException) ex).getPath()).isEqualTo(blocked.toString()));
    }
}
