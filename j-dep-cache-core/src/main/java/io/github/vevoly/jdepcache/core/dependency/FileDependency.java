package io.github.vevoly.jdepcache.core.dependency;

import io.github.vevoly.jdepcache.api.JDepCache;
import io.github.vevoly.jdepcache.api.dependency.AbstractDependency;
import lombok.Getter;
import org.apache.commons.codec.digest.DigestUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * 基于文件的依赖：快照为文件内容的 MD5 与最后修改时间。文件不存在时快照为 null。
 * <p>
 * A file-based dependency: the snapshot is the MD5 of the file content plus its last-modified time.
 * A missing file yields a null snapshot, so a file appearing or disappearing counts as a change.
 *
 * @author vevoly
 */
@Getter
public class FileDependency extends AbstractDependency {

    private static final long serialVersionUID = 1L;

    /**
     * 文件路径。使用字符串保存以保证可序列化。
     * <p>
     * The file path, kept as a string to stay serializable.
     */
    private final String fileName;

    public FileDependency(Path file) {
        this(Objects.requireNonNull(file, "file must not be null").toString());
    }

    public FileDependency(String fileName) {
        this.fileName = Objects.requireNonNull(fileName, "fileName must not be null");
    }

    @Override
    protected Object generateDependencyData(JDepCache cache) {
        Path path = Paths.get(fileName);
        if (!Files.isRegularFile(path)) {
            return null;
        }
        try (InputStream in = Files.newInputStream(path)) {
            return DigestUtils.md5Hex(in) + ":" + Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read dependency file: " + fileName, e);
        }
    }
}
