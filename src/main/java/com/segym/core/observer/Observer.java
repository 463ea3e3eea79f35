package com.segym.core.observer;

import com.segym.core.model.Observation;
import com.segym.core.model.State;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Composes a {@link Reader} and a {@link Selector}: {@code observe(s) = select(read(s))}.
 * Neither stage may introduce randomness, so a fixed pair yields the same observation
 * for the same state.
 */
public class Observer {

    private static final Logger log = LoggerFactory.getLogger(Observer.class);

    private final Reader reader;
    private final Selector selector;

    public Observer(Reader reader, Selector selector) {
        this.reader = reader;
        this.selector = selector;
    }

    public Observation observe(State state) {
        var files = reader.read(state);
        var observation = selector.select(files);
        log.debug("Observed {} file(s), {} chars{}", observation.files().size(),
                observation.text().length(), observation.truncated() ? " (truncated)" : "");
        return observation;
    }
}
