package com.netdesk.ticket.polling;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ExclusiveLease} backed by OS advisory file locks, one file per key in a
 * shared directory. The operating system drops the lock when the holding process
 * exits, however it exits.
 *
 * <p>The holder writes its PID into the file for operators. The file itself is left in
 * place on release; only the lock matters.</p>
 */
public class FileLockExclusiveLease implements ExclusiveLease {

    private static final Logger log = LoggerFactory.getLogger(FileLockExclusiveLease.class);

    private final Path directory;
    private final Map<String, HeldLock> held = new HashMap<>();

    public FileLockExclusiveLease(Path directory) {
        this.directory = directory;
    }

    @Override
    public synchronized boolean tryAcquire(String key) {
        if (held.containsKey(key)) {
            return true;
        }
        Path file = lockFile(key);
        FileChannel channel = null;
        try {
            Files.createDirectories(directory);
            // no TRUNCATE_EXISTING: the current holder's PID must survive a failed attempt
            channel = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock lock = channel.tryLock();
            if (lock == null) {
                close(channel, key);
                return false;
            }
            channel.truncate(0);
            channel.write(ByteBuffer.wrap((ProcessHandle.current().pid() + "\n").getBytes(StandardCharsets.UTF_8)));
            channel.force(false);
            held.put(key, new HeldLock(channel, lock));
            log.debug("Lock {} acquired", file);
            return true;
        } catch (OverlappingFileLockException e) {
            // held by another lease object inside this JVM
            close(channel, key);
            return false;
        } catch (IOException e) {
            log.warn("Could not lock {}: {}", file, e.getMessage());
            close(channel, key);
            return false;
        }
    }

    @Override
    public synchronized void release(String key) {
        HeldLock current = held.remove(key);
        if (current == null) {
            return;
        }
        try {
            current.lock().release();
        } catch (IOException e) {
            log.warn("Could not release lock for {}: {}", key, e.getMessage());
        }
        close(current.channel(), key);
    }

    @Override
    public synchronized boolean isHeld(String key) {
        HeldLock current = held.get(key);
        return current != null && current.lock().isValid();
    }

    Path lockFile(String key) {
        return directory.resolve("netdesk-" + key + ".lock");
    }

    private static void close(FileChannel channel, String key) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("Could not close lock file for {}: {}", key, e.getMessage());
        }
    }

    private record HeldLock(FileChannel channel, FileLock lock) {
    }
}
