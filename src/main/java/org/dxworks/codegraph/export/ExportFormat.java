package org.dxworks.codegraph.export;

import com.fasterxml.jackson.core.JsonProcessingException;

import java.util.List;

public enum ExportFormat {
    TEXT("txt"),
    JSON("json"),
    DOT("dot");

    private final String extension;

    ExportFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Renders the documents one after another. JSON writes a single document as an object
     * and several as an array.
     */
    public String render(List<GraphDocument> documents) throws JsonProcessingException {
        switch (this) {
            case JSON:
                if (documents.size() == 1) {
                    return documents.get(0).toJson();
                }
                return GraphDocument.MAPPER.writeValueAsString(documents);
            case DOT: {
                DotRenderer renderer = new DotRenderer();
                StringBuilder sb = new StringBuilder();
                for (GraphDocument document : documents) {
                    sb.append(renderer.render(document));
                }
                return sb.toString();
            }
            default: {
                TextRenderer renderer = new TextRenderer();
                StringBuilder sb = new StringBuilder();
                for (int i = 0; i < documents.size(); i++) {
                    if (i > 0) {
                        sb.append('\n');
                    }
                    sb.append(renderer.render(documents.get(i)));
                }
                return sb.toString();
            }
        }
    }
}
