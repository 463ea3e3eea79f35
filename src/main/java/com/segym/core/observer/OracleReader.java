package com.segym.core.observer;

import com.segym.core.model.State;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Reads an operator-supplied, fixed list of files. No search is involved.
 */
public class OracleReader implements Reader {

    private static final Logger log = LoggerFactory.getLogger(OracleReader.class);

    private final List<String> files;

    public OracleReader(List<String> files) {
        this.files = List.copyOf(files);
    }

    @Override
    public SortedMap<String, String> read(State state) {
        var contents = new TreeMap<String, String>();
        for (String file : files) {
            try {
                String content = TreeFiles.read(state, file);
                if (content == null) {
                    log.warn("Oracle file {} not found under {}", file, state.root());
                    continue;
                }
                contents.put(file, content);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + file, e);
            }
        }
        return contents;
    }
}
