package com.ryuqq.pipeline.adapter.file.io;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * 임시 파일 + fsync + rename 방식의 원자적 파일 쓰기.
 *
 * <p>대상과 같은 디렉터리에 임시 파일을 만들고 내용을 디스크까지 동기화한 뒤
 * {@link StandardCopyOption#ATOMIC_MOVE}로 교체합니다. 읽는 쪽은 이전 내용 또는
 * 새 내용 중 하나만 관찰합니다.</p>
 *
 * <p>임시 파일 이름은 {@code .<대상 이름>.<난수>.tmp} 형식입니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class AtomicFileWriter {

    // Utility class - prevent instantiation
    private AtomicFileWriter() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 대상 파일을 원자적으로 교체.
     *
     * @param target 대상 파일
     * @param content 기록할 내용
     * @throws IOException 쓰기, 동기화, 이동 중 하나라도 실패한 경우 (대상은 변경되지 않음)
     */
    public static void write(Path target, byte[] content) throws IOException {
        Path temp = writeTemp(target, content);
        boolean moved = false;
        try {
            move(temp, target);
            moved = true;
        } finally {
            if (!moved) {
                Files.deleteIfExists(temp);
            }
        }
    }

    /**
     * 대상과 같은 디렉터리에 동기화된 임시 파일 생성.
     *
     * <p>호출자가 임시 파일을 이동하거나 삭제할 책임을 집니다.</p>
     */
    public static Path writeTemp(Path target, byte[] content) throws IOException {
        Path directory = target.toAbsolutePath().getParent();
        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, "." + target.getFileName() + ".", ".tmp");
        boolean written = false;
        try {
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(content);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            written = true;
            return temp;
        } finally {
            if (!written) {
                Files.deleteIfExists(temp);
            }
        }
    }

    private static void move(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
