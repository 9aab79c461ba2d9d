package com.vidforge.common.exception;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JobExceptionTest {

    @Test
    void testToJobMessage_PrefixedWithCode() {
        // Given
        JobException e = new JobException(ErrorCode.RENDER_ASSEMBLY_FAILED, "ffmpeg exited with 1");

        // When
        String message = e.toJobMessage();

        // Then
        assertEquals("[R006] ffmpeg exited with 1", message);
    }

    @Test
    void testDefaultMessage_FromErrorCode() {
        // Given
        JobException e = new JobException(ErrorCode.JOB_NOT_FOUND);

        // Then
        assertEquals(ErrorCode.JOB_NOT_FOUND.getMessage(), e.getMessage());
        assertTrue(e.toJobMessage().startsWith("[J001] "));
    }
}
