package com.evaluate.interviewcoach.service.extraction;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Azure Speech backed transcription. The SDK is optional at runtime and reached through
 * reflection; without it, or without credentials, every transcription is empty.
 */
@Service
@Slf4j
public class SpeechTranscriptionService implements TranscriptionService {

    private static final String SDK = "com.microsoft.cognitiveservices.speech.";

    @Value("${azure.speech.key:}")
    private String speechKey;

    @Value("${azure.speech.region:}")
    private String speechRegion;

    @Value("${azure.speech.language:en-US}")
    private String language;

    private Object speechConfig;

    @PostConstruct
    public void initialize() {
        if (speechKey == null || speechKey.isEmpty() || speechRegion == null || speechRegion.isEmpty()) {
            log.info("Transcription disabled (Azure Speech credentials not configured)");
            return;
        }
        try {
            Class<?> speechConfigClass = Class.forName(SDK + "SpeechConfig");
            Object config = speechConfigClass.getMethod("fromSubscription", String.class, String.class)
                    .invoke(null, speechKey, speechRegion);
            speechConfigClass.getMethod("setSpeechRecognitionLanguage", String.class).invoke(config, language);
            speechConfig = config;
            log.info("Transcription enabled with Azure Speech ({})", language);
        } catch (ClassNotFoundException e) {
            log.info("Transcription disabled (Azure Speech SDK not on the classpath)");
        } catch (ReflectiveOperationException e) {
            log.warn("Failed to initialize Azure Speech: {}", e.getMessage());
        }
    }

    public boolean isAvailable() {
        return speechConfig != null;
    }

    @Override
    public String transcribe(byte[] audio) {
        if (audio == null || audio.length == 0) {
            return "";
        }
        if (!isAvailable()) {
            log.warn("Transcription requested for {} bytes but speech recognition is not available", audio.length);
            return "";
        }

        Path tempFile = null;
        Object audioConfig = null;
        Object recognizer = null;
        Object result = null;
        try {
            tempFile = Files.createTempFile("answer-audio-", ".wav");
            Files.write(tempFile, toWav(audio));

            Class<?> audioConfigClass = Class.forName(SDK + "audio.AudioConfig");
            audioConfig = audioConfigClass.getMethod("fromWavFileInput", String.class)
                    .invoke(null, tempFile.toString());

            Class<?> recognizerClass = Class.forName(SDK + "SpeechRecognizer");
            recognizer = recognizerClass
                    .getConstructor(Class.forName(SDK + "SpeechConfig"), audioConfigClass)
                    .newInstance(speechConfig, audioConfig);

            Object future = recognizerClass.getMethod("recognizeOnceAsync").invoke(recognizer);
            result = future.getClass().getMethod("get").invoke(future);
            String reason = String.valueOf(result.getClass().getMethod("getReason").invoke(result));

            if (!"RecognizedSpeech".equals(reason)) {
                log.warn("Speech recognition finished without text: {}", reason);
                return "";
            }
            String text = (String) result.getClass().getMethod("getText").invoke(result);
            log.info("Transcribed {} bytes into {} characters", audio.length, text == null ? 0 : text.length());
            return text == null ? "" : text.trim();
        } catch (IOException | ReflectiveOperationException e) {
            log.error("Speech recognition failed: {}", e.getMessage());
            return "";
        } finally {
            close(result);
            close(recognizer);
            close(audioConfig);
            deleteQuietly(tempFile);
        }
    }

    /** Releases a native SDK handle through its {@code close()} method; null is a no-op. */
    static void close(Object handle) {
        if (handle == null) {
            return;
        }
        try {
            handle.getClass().getMethod("close").invoke(handle);
        } catch (ReflectiveOperationException e) {
            log.warn("Could not close speech SDK {}", handle.getClass().getSimpleName(), e);
        }
    }

    /** Wraps raw 16 kHz mono PCM in a WAV header; RIFF input passes through. */
    static byte[] toWav(byte[] audio) throws IOException {
        if (audio.length >= 4 && audio[0] == 'R' && audio[1] == 'I' && audio[2] == 'F' && audio[3] == 'F') {
            return audio;
        }

        int sampleRate = 16000;
        int bitsPerSample = 16;
        int numChannels = 1;

        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (DataOutputStream dos = new DataOutputStream(baos)) {
            dos.writeBytes("RIFF");
            writeIntLE(dos, 36 + audio.length);
            dos.writeBytes("WAVE");
            dos.writeBytes("fmt ");
            writeIntLE(dos, 16);
            writeShortLE(dos, (short) 1);
            writeShortLE(dos, (short) numChannels);
            writeIntLE(dos, sampleRate);
            writeIntLE(dos, sampleRate * numChannels * bitsPerSample / 8);
            writeShortLE(dos, (short) (numChannels * bitsPerSample / 8));
            writeShortLE(dos, (short) bitsPerSample);
            dos.writeBytes("data");
            writeIntLE(dos, audio.length);
            dos.write(audio);
        }
        return baos.toByteArray();
    }

    private static void writeIntLE(DataOutputStream dos, int value) throws IOException {
        dos.write(value & 0xFF);
        dos.write((value >> 8) & 0xFF);
        dos.write((value >> 16) & 0xFF);
        dos.write((value >> 24) & 0xFF);
    }

    private static void writeShortLE(DataOutputStream dos, short value) throws IOException {
        dos.write(value & 0xFF);
        dos.write((value >> 8) & 0xFF);
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete temporary audio file {}", file, e);
        }
    }
}
