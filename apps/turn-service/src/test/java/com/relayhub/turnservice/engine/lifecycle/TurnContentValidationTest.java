package com.relayhub.turnservice.engine.lifecycle;

import com.relayhub.turnservice.domain.enums.ContentType;
import com.relayhub.turnservice.domain.enums.TurnStatus;
import com.relayhub.turnservice.domain.enums.TurnType;
import com.relayhub.turnservice.domain.model.Turn;
import com.relayhub.turnservice.engine.core.EngineException;
import com.relayhub.turnservice.engine.core.ErrorCode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TurnContentValidationTest {

    private final Turn writing = Turn.builder().type(TurnType.WRITING).status(TurnStatus.PENDING).build();
    private final Turn drawing = Turn.builder().type(TurnType.DRAWING).status(TurnStatus.PENDING).build();

    private static void assertValidationError(Runnable call) {
        assertThatThrownBy(call::run)
                .isInstanceOf(EngineException.class)
                .extracting(e -> ((EngineException) e).getCode())
                .isEqualTo(ErrorCode.VALIDATION);
    }

    @Test
    void textAcceptedForWritingTurn() {
        assertThatCode(() -> TurnLifecycleManagerImpl.validateContent(writing, "  a fox on the moon ", ContentType.TEXT))
                .doesNotThrowAnyException();
    }

    @Test
    void imageRejectedForWritingTurn() {
        assertValidationError(() -> TurnLifecycleManagerImpl.validateContent(writing, "https://x.test/a.png", ContentType.IMAGE));
    }

    @Test
    void textRejectedForDrawingTurn() {
        assertValidationError(() -> TurnLifecycleManagerImpl.validateContent(drawing, "a drawing of a fox", ContentType.TEXT));
    }

    @Test
    void blankContentRejected() {
        assertValidationError(() -> TurnLifecycleManagerImpl.validateContent(writing, "   ", ContentType.TEXT));
        assertValidationError(() -> TurnLifecycleManagerImpl.validateContent(writing, null, ContentType.TEXT));
    }

    @Test
    void missingContentTypeRejected() {
        assertValidationError(() -> TurnLifecycleManagerImpl.validateContent(writing, "hello", null));
    }

    @Test
    void overlongTextRejected() {
        String text = "x".repeat(TurnLifecycleManagerImpl.MAX_TEXT_LENGTH + 1);
        assertValidationError(() -> TurnLifecycleManagerImpl.validateContent(writing, text, ContentType.TEXT));
    }

    @Test
    void imageMustBeHttpUrl() {
        assertValidationError(() -> TurnLifecycleManagerImpl.validateContent(drawing, "ftp://x.test/a.png", ContentType.IMAGE));
        assertValidationError(() -> TurnLifecycleManagerImpl.validateContent(drawing, "not a url", ContentType.IMAGE));
        assertThatCode(() -> TurnLifecycleManagerImpl.validateContent(drawing, "https://cdn.test/fox.png", ContentType.IMAGE))
                .doesNotThrowAnyException();
        assertThatCode(() -> TurnLifecycleManagerImpl.validateContent(drawing, "http://cdn.test/fox.png", ContentType.IMAGE))
                .doesNotThrowAnyException();
    }
}
