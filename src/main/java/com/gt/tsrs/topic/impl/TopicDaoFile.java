package com.gt.tsrs.topic.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.tsrs.converter.FileTopicRecordConverter;
import com.gt.tsrs.exception.DuplicateTopicException;
import com.gt.tsrs.exception.InvalidStateException;
import com.gt.tsrs.exception.PersistenceException;
import com.gt.tsrs.ladder.IntervalLadder;
import com.gt.tsrs.model.Topic;
import com.gt.tsrs.topic.TopicDao;
import com.gt.tsrs.topic.TopicStoreLock;
import com.gt.tsrs.topic.model.FileTopicRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.*;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Stores all topics in a single JSON object keyed by topic name.
 *
 * <p>Writes go to a temporary file in the store's directory which is then renamed over the store,
 * so readers only ever see a complete file. Writers serialize on an in-process lock plus an OS file
 * lock on a sibling {@code .lock} file, which also excludes other processes sharing the store.
 */
@Component
public class TopicDaoFile implements TopicDao {

    private static final Logger log = LoggerFactory.getLogger(TopicDaoFile.class);

    private static final String LOCK_FILE_SUFFIX = ".lock";
    private static final String TEMP_FILE_SUFFIX = ".tmp";
    private static final long LOCK_RETRY_MS = 25;

    private final Path storePath;
    private final Path lockPath;
    private final long lockTimeoutMs;
    private final ObjectMapper objectMapper;
    private final IntervalLadder intervalLadder;

    private final ReentrantLock processLock = new ReentrantLock();

    @Autowired
    public TopicDaoFile(@Value("${tsrs.store.path:data/spaced_repetition.json}") String storePath,
                        @Value("${tsrs.store.lockTimeoutMs:5000}") long lockTimeoutMs,
                        ObjectMapper objectMapper,
                        IntervalLadder intervalLadder) {
        this.storePath = Paths.get(storePath).toAbsolutePath();
        this.lockPath = this.storePath.resolveSibling(this.storePath.getFileName() + LOCK_FILE_SUFFIX);
        this.lockTimeoutMs = lockTimeoutMs;
        this.objectMapper = objectMapper;
        this.intervalLadder = intervalLadder;
    }

    @Override
    public List<Topic> loadTopics() {
        return readStore(true).topics();
    }

    private StoreContents readStore(boolean warnOnSkip) {
        if (!Files.exists(storePath)) {
            log.debug("No topic store at {}, starting empty", storePath);
            return StoreContents.EMPTY;
        }

        JsonNode root;
        try {
            if (Files.size(storePath) == 0) {
                log.warn("Topic store {} is empty, treating as no topics", storePath);
                return StoreContents.EMPTY;
            }

            root = objectMapper.readTree(storePath.toFile());
        } catch (IOException ex) {
            String errMsg = "Unable to read topic store " + storePath;

            log.error(errMsg);
            throw new PersistenceException(errMsg, ex);
        }

        if (root == null || !root.isObject()) {
            String errMsg = "Topic store " + storePath + " does not contain a JSON object";

            log.error(errMsg);
            throw new PersistenceException(errMsg);
        }

        List<Topic> topics = new ArrayList<>();
        Map<String, JsonNode> unreadable = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();

            try {
                FileTopicRecord record = objectMapper.treeToValue(field.getValue(), FileTopicRecord.class);
                topics.add(FileTopicRecordConverter.convertFileTopicRecord(field.getKey(), record, intervalLadder));
            } catch (JsonProcessingException | InvalidStateException ex) {
                if (warnOnSkip) {
                    log.warn("Skipping unreadable topic '{}' in {}: {}", field.getKey(), storePath, ex.getMessage());
                }
                unreadable.put(field.getKey(), field.getValue());
            }
        }

        return new StoreContents(topics, unreadable);
    }

    // Entries the last load had to skip are written back untouched unless a topic of the same name replaces them
    @Override
    public void saveTopics(Collection<Topic> topics) {
        Map<String, Object> records = new TreeMap<>();
        for (Topic topic : topics) {
            if (records.put(topic.name(), FileTopicRecordConverter.convertTopic(topic)) != null) {
                throw new DuplicateTopicException(topic.name());
            }
        }

        if (Files.isRegularFile(storePath)) {
            for (Map.Entry<String, JsonNode> entry : readStore(false).unreadable().entrySet()) {
                if (records.putIfAbsent(entry.getKey(), entry.getValue()) == null) {
                    log.debug("Keeping unreadable topic '{}' in {}", entry.getKey(), storePath);
                }
            }
        }

        byte[] content;
        try {
            content = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(records);
        } catch (JsonProcessingException ex) {
            String errMsg = "Unable to serialize " + records.size() + " topics";

            log.error(errMsg);
            throw new PersistenceException(errMsg, ex);
        }

        Path tempFile = null;
        try {
            Files.createDirectories(storePath.getParent());
            tempFile = Files.createTempFile(storePath.getParent(), storePath.getFileName().toString(), TEMP_FILE_SUFFIX);

            try (FileChannel channel = FileChannel.open(tempFile, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(content);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }

            replaceStore(tempFile);
            log.debug("Saved {} topics to {}", records.size(), storePath);
        } catch (IOException ex) {
            String errMsg = "Unable to write topic store " + storePath;

            log.error(errMsg);
            PersistenceException persistenceException = new PersistenceException(errMsg, ex);
            deleteTempFile(tempFile, persistenceException);
            throw persistenceException;
        }
    }

    @Override
    public TopicStoreLock lockStore() {
        if (processLock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Topic store lock is already held by this thread");
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(lockTimeoutMs);
        try {
            if (!processLock.tryLock(lockTimeoutMs, TimeUnit.MILLISECONDS)) {
                throw lockTimeout();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new PersistenceException("Interrupted while waiting for topic store lock " + lockPath, ex);
        }

        FileChannel channel = null;
        try {
            Files.createDirectories(lockPath.getParent());
            channel = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);

            FileLock fileLock = channel.tryLock();
            while (fileLock == null) {
                if (System.nanoTime() >= deadline) {
                    throw lockTimeout();
                }
                Thread.sleep(LOCK_RETRY_MS);
                fileLock = channel.tryLock();
            }

            return new FileTopicStoreLock(channel, fileLock);
        } catch (IOException | InterruptedException | RuntimeException ex) {
            if (ex instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }

            closeChannel(channel, ex);
            processLock.unlock();

            if (ex instanceof PersistenceException) {
                throw (PersistenceException) ex;
            }
            throw new PersistenceException("Unable to lock topic store " + lockPath, ex);
        }
    }

    public Path getStorePath() {
        return storePath;
    }

    private void replaceStore(Path tempFile) throws IOException {
        try {
            Files.move(tempFile, storePath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            log.warn("Atomic rename not supported for {}, falling back to replace", storePath);
            Files.move(tempFile, storePath, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private PersistenceException lockTimeout() {
        String errMsg = "Timed out after " + lockTimeoutMs + "ms waiting for topic store lock " + lockPath;

        log.error(errMsg);
        return new PersistenceException(errMsg);
    }

    private static void deleteTempFile(Path tempFile, Exception cause) {
        if (tempFile == null) {
            return;
        }

        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException ex) {
            cause.addSuppressed(ex);
        }
    }

    private static void closeChannel(FileChannel channel, Exception cause) {
        if (channel == null) {
            return;
        }

        try {
            channel.close();
        } catch (IOException ex) {
            cause.addSuppressed(ex);
        }
    }

    private record StoreContents(List<Topic> topics, Map<String, JsonNode> unreadable) {
        private static final StoreContents EMPTY = new StoreContents(List.of(), Map.of());
    }

    private class FileTopicStoreLock implements TopicStoreLock {

        private final FileChannel channel;
        private final FileLock fileLock;
        private boolean released = false;

        private FileTopicStoreLock(FileChannel channel, FileLock fileLock) {
            this.channel = channel;
            this.fileLock = fileLock;
        }

        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;

            try {
                try {
                    fileLock.release();
                } finally {
                    channel.close();
                }
            } catch (IOException ex) {
                log.warn("Error releasing topic store lock {}", lockPath, ex);
            } finally {
                processLock.unlock();
            }
        }
    }
}
