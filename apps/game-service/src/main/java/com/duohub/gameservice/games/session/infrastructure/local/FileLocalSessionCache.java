package com.duohub.gameservice.games.session.infrastructure.local;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import com.duohub.gameservice.games.session.domain.model.GameSession;
import com.duohub.gameservice.games.session.domain.model.SessionIds;
import com.duohub.gameservice.games.session.infrastructure.codec.SessionCodec;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * 文件版本地缓存：每个会话一个 {sessionId}.json，进程重启后恢复（含待同步标记）。
 * 文件内容：{"session": 会话文档, "confirmedVersion": n, "pending": bool}
 */
@Slf4j
public class FileLocalSessionCache extends InMemoryLocalSessionCache {

    private final Path dir;
    private final SessionCodec codec;

    public FileLocalSessionCache(Path dir, SessionCodec codec) {
        this.dir = dir;
        this.codec = codec;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create local cache dir " + dir, e);
        }
        load();
    }

    private void load() {
        int loaded = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*.json")) {
            for (Path file : files) {
                try {
                    JSONObject doc = JSON.parseObject(Files.readString(file, StandardCharsets.UTF_8));
                    Entry e = new Entry();
                    e.session = codec.fromDocument(doc.getJSONObject("session"));
                    e.confirmedVersion = doc.containsKey("confirmedVersion")
                            ? doc.getLongValue("confirmedVersion") : NEVER_CONFIRMED;
                    e.pending = doc.getBooleanValue("pending");
                    entries.put(e.session.getId(), e);
                    loaded++;
                } catch (IOException | RuntimeException ex) {
                    log.warn("本地缓存文件损坏，已跳过: file={}, err={}", file, ex.toString());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read local cache dir " + dir, e);
        }
        log.info("本地会话缓存已加载: dir={}, sessions={}", dir, loaded);
    }

    @Override
    public void put(GameSession session) {
        SessionIds.require(session.getId());
        super.put(session);
    }

    @Override
    protected void persist(String sessionId, Entry entry) {
        if (entry.session == null) return;
        JSONObject doc = new JSONObject();
        doc.put("session", codec.toDocument(entry.session));
        doc.put("confirmedVersion", entry.confirmedVersion);
        doc.put("pending", entry.pending);
        Path target = fileOf(sessionId);
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.writeString(tmp, doc.toJSONString(), StandardCharsets.UTF_8);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot write local cache " + target, e);
        }
    }

    @Override
    protected void erase(String sessionId) {
        try {
            Files.deleteIfExists(fileOf(sessionId));
        } catch (IOException e) {
            throw new UncheckedIOException("cannot delete local cache " + sessionId, e);
        }
    }

    private Path fileOf(String sessionId) {
        return dir.resolve(SessionIds.require(sessionId) + ".json");
    }
}
