package com.my.fitsync.adapter.out.filesystem;

import com.my.fitsync.config.AppConfig;
import com.my.fitsync.domain.exception.StorageException;
import com.my.fitsync.domain.model.AccountKeys;
import com.my.fitsync.domain.model.MetricKind;
import com.my.fitsync.domain.model.MetricPayload;
import com.my.fitsync.domain.model.StoredArtifact;
import com.my.fitsync.domain.port.out.ResultStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * 왜: 수집 결과를 계정별 디렉터리에 (날짜, 지표) 당 파일 하나로 남기고, 임시 파일 후 rename 으로 써서 읽는 쪽이 반쯤 쓰인 파일을 보지 않게 하기 위함.
 *
 * <p>레이아웃: {@code <data-path>/<accountKey>/<yyyy-MM-dd>_<metric>.json}
 */
@ApplicationScoped
public class FileSystemResultStore implements ResultStore {

    private static final Logger log = Logger.getLogger(FileSystemResultStore.class);

    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE;
    private static final Pattern ARTIFACT = Pattern.compile("(\\d{4}-\\d{2}-\\d{2})_([a-z0-9-]+)\\.json");
    private static final String TEMP_PREFIX = ".tmp-";

    private final Path dataRoot;

    @Inject
    public FileSystemResultStore(AppConfig appConfig) {
        this(Path.of(appConfig.paths().dataPath()));
    }

    public FileSystemResultStore(Path dataRoot) {
        this.dataRoot = dataRoot;
    }

    @Override
    public void save(String accountKey, MetricKind kind, LocalDate date, MetricPayload payload) {
        Path target = artifactPath(accountKey, kind, date);
        Path directory = target.getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, TEMP_PREFIX, ".part");
            Files.write(temp, payload.bytes());
            move(temp, target);
            log.infof("지표 저장 완료: account=%s file=%s bytes=%d", accountKey, target.getFileName(), payload.bytes().length);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new StorageException("지표 저장 실패: " + target, e);
        }
    }

    @Override
    public boolean exists(String accountKey, MetricKind kind, LocalDate date) {
        return Files.isRegularFile(artifactPath(accountKey, kind, date));
    }

    @Override
    public Optional<StoredArtifact> find(String accountKey, MetricKind kind, LocalDate date) {
        Path path = artifactPath(accountKey, kind, date);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(new StoredArtifact(accountKey, kind.name(), date, Files.readAllBytes(path),
                    Files.getLastModifiedTime(path).toInstant()));
        } catch (IOException e) {
            throw new StorageException("지표 조회 실패: " + path, e);
        }
    }

    @Override
    public List<StoredArtifact> history(String accountKey) {
        Path directory = accountDirectory(accountKey);
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<StoredArtifact> artifacts = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path path : (Iterable<Path>) files::iterator) {
                toArtifact(accountKey, path).ifPresent(artifacts::add);
            }
        } catch (IOException e) {
            throw new StorageException("동기화 이력 조회 실패: " + directory, e);
        }
        artifacts.sort(Comparator.comparing(StoredArtifact::date).thenComparing(StoredArtifact::metric));
        return List.copyOf(artifacts);
    }

    private Optional<StoredArtifact> toArtifact(String accountKey, Path path) throws IOException {
        Matcher matcher = ARTIFACT.matcher(path.getFileName().toString());
        if (!matcher.matches() || !Files.isRegularFile(path)) {
            return Optional.empty();
        }
        LocalDate date;
        try {
            date = LocalDate.parse(matcher.group(1), DATE);
        } catch (DateTimeParseException e) {
            log.warnf("날짜 형식이 아닌 파일을 건너뜁니다: %s", path.getFileName());
            return Optional.empty();
        }
        return Optional.of(new StoredArtifact(accountKey, matcher.group(2), date, Files.readAllBytes(path),
                Files.getLastModifiedTime(path).toInstant()));
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warnf("임시 파일 삭제 실패: %s (%s)", temp, e.getMessage());
        }
    }

    Path artifactPath(String accountKey, MetricKind kind, LocalDate date) {
        return accountDirectory(accountKey).resolve(DATE.format(date) + "_" + kind.name() + ".json");
    }

    private Path accountDirectory(String accountKey) {
        return dataRoot.resolve(AccountKeys.requireValid(accountKey));
    }
}
