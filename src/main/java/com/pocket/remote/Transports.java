package com.pocket.remote;

import com.pocket.exception.RemoteException;
import lombok.experimental.UtilityClass;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * 根据 URL 选择传输方式。目前只支持本地路径（file:// 或普通路径）。
 */
@UtilityClass
public class Transports {

    private static final String SCHEME_SEPARATOR = "://";

    /** 默认工厂：相对路径以 baseDir 为基准解析。 */
    public static TransportFactory defaultFactory(Path baseDir) {
        return remote -> open(remote, baseDir);
    }

    public static RemoteTransport open(Remote remote, Path baseDir) throws RemoteException {
        String url = remote.getUrl();
        String scheme = schemeOf(url);
        if (scheme == null || scheme.equals("file")) {
            return new LocalTransport(localPath(url, baseDir));
        }
        throw new RemoteException("unsupported transport '" + scheme + "' for remote '" + remote.getName()
                + "' (only local paths and file:// URLs are supported)");
    }

    /**
     * 校验 URL：非空、无空白；带 scheme 时必须能解析为 URI。
     */
    public static void validateUrl(String url) throws RemoteException {
        if (url == null || url.isBlank() || url.chars().anyMatch(Character::isWhitespace)) {
            throw new RemoteException("invalid remote url '" + url + "'");
        }
        if (url.contains(SCHEME_SEPARATOR)) {
            try {
                URI uri = new URI(url);
                if (uri.getScheme() == null || (uri.getHost() == null && (uri.getPath() == null || uri.getPath().isEmpty()))) {
                    throw new RemoteException("invalid remote url '" + url + "'");
                }
            } catch (URISyntaxException e) {
                throw new RemoteException("invalid remote url '" + url + "': " + e.getReason(), e);
            }
        }
    }

    /** URL 的 scheme（小写），普通路径返回 null。 */
    static String schemeOf(String url) {
        int idx = url.indexOf(SCHEME_SEPARATOR);
        if (idx <= 0) {
            return null;
        }
        return url.substring(0, idx).toLowerCase(Locale.ROOT);
    }

    static Path localPath(String url, Path baseDir) throws RemoteException {
        if (url.contains(SCHEME_SEPARATOR)) {
            try {
                return Paths.get(new URI(url)).toAbsolutePath().normalize();
            } catch (URISyntaxException | IllegalArgumentException e) {
                throw new RemoteException("invalid file url '" + url + "'", e);
            }
        }
        Path p = Paths.get(url);
        return (p.isAbsolute() ? p : baseDir.resolve(p)).toAbsolutePath().normalize();
    }
}
