package com.purchasingpower.workgraph.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.purchasingpower.workgraph.core.ErrorKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Envelope of a tool call: one text block holding the JSON result, or the error text.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolCallResponse {

    private List<ContentBlock> content;

    @JsonProperty("isError")
    private Boolean isError;

    private ErrorKind errorKind;

    public static ToolCallResponse success(String text) {
        return ToolCallResponse.builder()
            .content(List.of(ContentBlock.text(text)))
            .build();
    }

    public static ToolCallResponse error(ErrorKind kind, String text) {
        return ToolCallResponse.builder()
            .content(List.of(ContentBlock.text(text)))
            .isError(true)
            .errorKind(kind)
            .build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ContentBlock {

        private String type;
        private String text;

        public static ContentBlock text(String text) {
            return new ContentBlock("text", text);
        }
    }
}
