package com.segym.core.llm;

/**
 * One structured model call.
 *
 * @param systemPrompt instructions for the model's role
 * @param userPrompt   task text, e.g. the rendered observation
 * @param outputType   record the response must deserialize into
 */
public record ModelRequest<T>(
    String systemPrompt,
    String userPrompt,
    Class<T> outputType
) {}
