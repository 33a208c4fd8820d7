package com.evaluate.interviewcoach.service.extraction;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SpeechTranscriptionServiceTest {

    static class NativeHandle {
        int closeCalls;

        public void close() {
            closeCalls++;
        }
    }

    static class BrokenHandle {
        public void close() {
            throw new IllegalStateException("already released");
        }
    }

    @Test
    void closeReleasesTheHandle() {
        NativeHandle handle = new NativeHandle();

        SpeechTranscriptionService.close(handle);

        assertEquals(1, handle.closeCalls);
    }

    @Test
    void closeIgnoresMissingHandles() {
        assertDoesNotThrow(() -> SpeechTranscriptionService.close(null));
    }

    @Test
    void failureToCloseIsLoggedNotThrown() {
        assertDoesNotThrow(() -> SpeechTranscriptionService.close(new BrokenHandle()));
        assertDoesNotThrow(() -> SpeechTranscriptionService.close("no close method"));
    }

    @Test
    void transcriptionWithoutCredentialsIsEmpty() {
        SpeechTranscriptionService service = new SpeechTranscriptionService();
        service.initialize();

        assertFalse(service.isAvailable());
        assertEquals("", service.transcribe(new byte[]{1, 2, 3, 4}));
        assertEquals("", service.transcribe(new byte[0]));
    }

    @Test
    void rawPcmIsWrappedInAWavHeader() throws Exception {
        byte[] pcm = {10, 20, 30, 40};

        byte[] wav = SpeechTranscriptionService.toWav(pcm);

        assertEquals(44 + pcm.length, wav.length);
        assertEquals("RIFF", new String(wav, 0, 4, StandardCharsets.US_ASCII));
        assertEquals("WAVE", new String(wav, 8, 4, StandardCharsets.US_ASCII));
        assertArrayEquals(pcm, Arrays.copyOfRange(wav, 44, wav.length));
    }

    @Test
    void wavInputPassesThrough() throws Exception {
        byte[] wav = SpeechTranscriptionService.toWav(new byte[]{1, 2});

        assertTrue(Arrays.equals(wav, SpeechTranscriptionService.toWav(wav)));
    }
}
