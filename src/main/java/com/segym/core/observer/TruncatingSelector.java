package com.segym.core.observer;

import com.segym.core.ConfigurationException;
import com.segym.core.model.Observation;

import java.util.ArrayList;
import java.util.SortedMap;

/**
 * Fills files in path order until a character budget is spent. The file that crosses the
 * budget is cut with a truncation marker; files after it are dropped.
 */
public class TruncatingSelector implements Selector {

    private final int maxChars;

    public TruncatingSelector(int maxChars) {
        if (maxChars <= 0) {
            throw new ConfigurationException("maxChars must be positive, got " + maxChars);
        }
        this.maxChars = maxChars;
    }

    @Override
    public Observation select(SortedMap<String, String> files) {
        var text = new StringBuilder();
        var included = new ArrayList<String>();
        boolean truncated = false;

        for (var entry : files.entrySet()) {
            String rendered = ObservationFormat.render(entry.getKey(), entry.getValue());
            int remaining = maxChars - text.length();
            if (rendered.length() <= remaining) {
                text.append(rendered);
                included.add(entry.getKey());
                continue;
            }
            truncated = true;
            String header = ObservationFormat.header(entry.getKey());
            int overhead = header.length() + ObservationFormat.TRUNCATION_MARKER.length()
                    + ObservationFormat.footer().length();
            int room = remaining - overhead;
            if (room > 0) {
                text.append(header)
                        .append(entry.getValue(), 0, Math.min(room, entry.getValue().length()))
                        .append(ObservationFormat.TRUNCATION_MARKER)
                        .append(ObservationFormat.footer());
                included.add(entry.getKey());
            }
            break;
        }
        return new Observation(text.toString(), included, truncated);
    }
}
