package com.segym.core.observer;

import com.segym.core.model.Observation;
import com.segym.core.model.State;
import com.segym.core.model.TestReport;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ObserverTest {

    @Test
    void composesReaderAndSelector() {
        var state = State.baseline(1, Path.of("/tmp/project"), TestReport.fromCases(0, List.of(), ""));
        var files = new TreeMap<String, String>();
        files.put("calc.py", "return a - b");
        Reader reader = mock(Reader.class);
        Selector selector = mock(Selector.class);
        var expected = new Observation("rendered", List.of("calc.py"), false);
        when(reader.read(state)).thenReturn(files);
        when(selector.select(files)).thenReturn(expected);

        assertSame(expected, new Observer(reader, selector).observe(state));
        verify(reader).read(state);
        verify(selector).select(files);
    }
}
