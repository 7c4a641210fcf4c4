package io.github.chirino.conversations.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Points at a file saved under the conversation's {@code workspace/} directory. Older documents
 * carry the rendered body inline in {@code content} instead of a {@code filename}.
 */
public class FileReferenceBlock extends ContentBlock {

    public static final String DEFAULT_CONTENT_TYPE = "html";

    @JsonProperty("content_id")
    private String contentId;

    @JsonProperty("content_type")
    private String contentType = DEFAULT_CONTENT_TYPE;

    private String title;
    private String filename;
    private String content;

    public FileReferenceBlock() {}

    public FileReferenceBlock(String contentId, String contentType, String title, String filename) {
        this.contentId = contentId;
        setContentType(contentType);
        this.title = title;
        this.filename = filename;
    }

    @Override
    public String getType() {
        return FILE_REFERENCE;
    }

    public String getContentId() {
        return contentId;
    }

    public void setContentId(String contentId) {
        this.contentId = contentId;
    }

    public String getContentType() {
        return contentType;
    }

    public void setContentType(String contentType) {
        this.contentType = contentType != null ? contentType : DEFAULT_CONTENT_TYPE;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getFilename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FileReferenceBlock that
                && Objects.equals(contentId, that.contentId)
                && Objects.equals(contentType, that.contentType)
                && Objects.equals(title, that.title)
                && Objects.equals(filename, that.filename)
                && Objects.equals(content, that.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(contentId, contentType, title, filename, content);
    }
}
