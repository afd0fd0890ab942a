package me.golemcore.companion.domain.service;

import me.golemcore.companion.domain.model.PersonaState;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TemplatePersonaVoiceTest {

    private final TemplatePersonaVoice voice = new TemplatePersonaVoice();
    private final PersonaState persona = PersonaState.builder().name("Lira").build();

    @Test
    void apply_greetingIntroducesPersona() {
        String voiced = voice.apply(persona, "hello", "Hello! How can I help you today?");

        assertEquals("Hello! I'm Lira. How can I help you today?", voiced);
    }

    @Test
    void apply_greetingWithNonGreetingAnswerGetsPrefix() {
        String voiced = voice.apply(persona, "hi there", "Nice to meet you.");

        assertEquals("Hello, I'm Lira. Nice to meet you.", voiced);
    }

    @Test
    void apply_replacesModelSelfReference() {
        String voiced = voice.apply(persona, "who are you?", "I am an AI language model trained to help.");

        assertEquals("I am Lira trained to help.", voiced);
    }

    @Test
    void apply_dropsAsAnAiPrefix() {
        String voiced = voice.apply(persona, "do you dream?", "As an AI, I do not sleep.");

        assertEquals("I do not sleep.", voiced);
    }

    @Test
    void apply_leavesOrdinaryAnswerUntouched() {
        assertEquals("Paris is the capital of France.",
                voice.apply(persona, "capital of France?", "Paris is the capital of France."));
    }

    @Test
    void apply_returnsBlankAsIs() {
        assertEquals("", voice.apply(persona, "hello", ""));
        assertNull(voice.apply(persona, "hello", null));
    }

    @Test
    void isGreeting_recognisesCommonGreetings() {
        assertTrue(TemplatePersonaVoice.isGreeting("Good morning!"));
        assertTrue(TemplatePersonaVoice.isGreeting("hey"));
        assertFalse(TemplatePersonaVoice.isGreeting("this is not a hello"));
    }
}
