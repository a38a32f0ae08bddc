package de.bsommerfeld.htmlview.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.net.URI;
import java.nio.file.Path;
import java.util.Objects;

/**
 * What the viewer should display. Serialized with a {@code type} tag:
 * {@code inline_html}, {@code local_file}, {@code app_dir} or
 * {@code remote_url}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ViewerContent.InlineHtml.class, name = "inline_html"),
        @JsonSubTypes.Type(value = ViewerContent.LocalFile.class, name = "local_file"),
        @JsonSubTypes.Type(value = ViewerContent.AppDir.class, name = "app_dir"),
        @JsonSubTypes.Type(value = ViewerContent.RemoteUrl.class, name = "remote_url")
})
public interface ViewerContent {

    static ViewerContent html(String html) {
        return new InlineHtml(html, null);
    }

    /**
     * Inline HTML markup.
     *
     * @param html    the markup to render
     * @param baseDir optional directory against which relative asset references
     *                in the markup are resolved
     */
    record InlineHtml(String html, @JsonProperty("base_dir") Path baseDir) implements ViewerContent {
        public InlineHtml {
            Objects.requireNonNull(html, "html");
        }
    }

    /** A single local file, usually an HTML document. */
    record LocalFile(Path path) implements ViewerContent {
        public LocalFile {
            Objects.requireNonNull(path, "path");
        }
    }

    /**
     * A directory containing a static web application.
     *
     * @param root  application root
     * @param entry entry document relative to {@code root}; the viewer falls back
     *              to {@code index.html} when absent
     */
    record AppDir(Path root, String entry) implements ViewerContent {
        public AppDir {
            Objects.requireNonNull(root, "root");
        }
    }

    /** A remote page. The viewer only loads it if remote content is allowed. */
    record RemoteUrl(URI url) implements ViewerContent {
        public RemoteUrl {
            Objects.requireNonNull(url, "url");
        }
    }
}
