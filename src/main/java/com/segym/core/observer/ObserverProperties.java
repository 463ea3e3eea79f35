package com.segym.core.observer;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "segym.observer")
public class ObserverProperties {

    /** "oracle" or "keyword". */
    private String reader = "keyword";
    private List<String> files = new ArrayList<>();
    /** Keywords for the keyword reader; blank derives them from the failing tests. */
    private String query = "";
    private int maxFiles = 5;
    private List<String> extensions = new ArrayList<>(List.of("py", "java", "js", "ts", "go", "rb"));
    /** "full" or "truncating". */
    private String selector = "full";
    private int maxChars = 60_000;

    public String getReader() { return reader; }
    public void setReader(String reader) { this.reader = reader; }
    public List<String> getFiles() { return files; }
    public void setFiles(List<String> files) { this.files = files; }
    public String getQuery() { return query; }
    public void setQuery(String query) { this.query = query; }
    public int getMaxFiles() { return maxFiles; }
    public void setMaxFiles(int maxFiles) { this.maxFiles = maxFiles; }
    public List<String> getExtensions() { return extensions; }
    public void setExtensions(List<String> extensions) { this.extensions = extensions; }
    public String getSelector() { return selector; }
    public void setSelector(String selector) { this.selector = selector; }
    public int getMaxChars() { return maxChars; }
    public void setMaxChars(int maxChars) { this.maxChars = maxChars; }
}
