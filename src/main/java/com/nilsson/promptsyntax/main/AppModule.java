package com.nilsson.promptsyntax.main;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.nilsson.promptsyntax.data.ParserSettings;
import com.nilsson.promptsyntax.data.SettingsRepository;
import com.nilsson.promptsyntax.service.ConjunctionJsonWriter;
import com.nilsson.promptsyntax.service.PromptParser;

public class AppModule extends AbstractModule {

    @Override
    protected void configure() {
        bind(SettingsRepository.class).in(Singleton.class);
        bind(ConjunctionJsonWriter.class).in(Singleton.class);
    }

    @Provides
    @Singleton
    public ParserSettings provideParserSettings(SettingsRepository repository) {
        return ParserSettings.fromRepository(repository);
    }

    /**
     * The grammar holds no per-call state, so one parser serves every caller.
     */
    @Provides
    @Singleton
    public PromptParser providePromptParser(ParserSettings settings) {
        return new PromptParser(settings);
    }
}
