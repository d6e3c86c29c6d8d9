package com.visualcompiler.core.compiler;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A visual program as exchanged with editors and stored in program files.
 *
 * <p><b>Example JSON:</b>
 * <pre>{@code
 * {
 *   "language": "python",
 *   "blocks": [
 *     { "id": "b1", "type": "start", "x": 100, "y": 40 },
 *     { "id": "b2", "type": "print", "properties": { "text": "Hello" } }
 *   ],
 *   "connections": [ { "from": "b1", "to": "b2" } ]
 * }
 * }</pre>
 *
 * @param language target language id, may be null
 * @param blocks blocks in editor order
 * @param connections connections in editor order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProgramSpec(
    @JsonProperty("language") String language,
    @JsonProperty("blocks") List<BlockSpec> blocks,
    @JsonProperty("connections") List<ConnectionSpec> connections
) {
    public ProgramSpec {
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
        connections = connections == null ? List.of() : List.copyOf(connections);
    }

    /**
     * Returns a copy targeting another language.
     *
     * @param languageId target language id
     * @return program spec with the language replaced
     */
    public ProgramSpec withLanguage(String languageId) {
        return new ProgramSpec(languageId, blocks, connections);
    }
}
