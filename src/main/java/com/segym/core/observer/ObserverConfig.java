package com.segym.core.observer;

import com.segym.core.ConfigurationException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.HashSet;
import java.util.Locale;

@Configuration
public class ObserverConfig {

    @Bean
    public Reader reader(ObserverProperties properties) {
        return switch (properties.getReader().toLowerCase(Locale.ROOT)) {
            case "oracle" -> {
                if (properties.getFiles().isEmpty()) {
                    throw new ConfigurationException("segym.observer.files must list at least one file for the oracle reader");
                }
                yield new OracleReader(properties.getFiles());
            }
            case "keyword" -> new KeywordReader(properties.getQuery(), properties.getMaxFiles(),
                    new HashSet<>(properties.getExtensions()));
            default -> throw new ConfigurationException("Unknown reader: " + properties.getReader());
        };
    }

    @Bean
    public Selector selector(ObserverProperties properties) {
        return switch (properties.getSelector().toLowerCase(Locale.ROOT)) {
            case "full" -> new FullSelector();
            case "truncating" -> new TruncatingSelector(properties.getMaxChars());
            default -> throw new ConfigurationException("Unknown selector: " + properties.getSelector());
        };
    }

    @Bean
    public Observer observer(Reader reader, Selector selector) {
        return new Observer(reader, selector);
    }
}
