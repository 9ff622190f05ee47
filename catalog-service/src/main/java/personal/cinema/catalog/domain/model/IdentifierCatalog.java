package personal.cinema.catalog.domain.model;

import personal.cinema.common.exception.BusinessException;
import personal.cinema.common.exception.ErrorCode;
import personal.cinema.common.result.Result;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Identifier Catalog
 * 이름(label)마다 고유한 숫자 ID를 부여하는 양방향 레지스트리
 *
 * ID는 1부터 증가하며 재사용되지 않는다 (clear() 이후에만 1부터 다시 시작).
 * 내부 동기화가 없으므로 BookingCatalog의 락 안에서만 사용한다.
 */
public class IdentifierCatalog {

    private static final long FIRST_ID = 1L;

    private final EntryType type;
    // 삽입 순서 = ID 오름차순
    private final Map<Long, String> labelsById = new LinkedHashMap<>();
    private final Set<String> labels = new HashSet<>();
    private long nextId = FIRST_ID;
    private volatile Snapshot snapshot = Snapshot.empty();

    public IdentifierCatalog(EntryType type) {
        if (type == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Entry type cannot be null");
        }
        this.type = type;
    }

    /**
     * 이름 일괄 등록
     * 하나라도 이미 존재하면 전체를 거절하고 카탈로그는 변경되지 않는다.
     *
     * @param newLabels 등록할 이름 집합
     * @return 새로 부여된 ID 집합, 또는 ALREADY_EXISTS 실패
     */
    public Result<Set<Long>> add(Set<String> newLabels) {
        validateLabels(newLabels);

        for (String label : newLabels) {
            if (labels.contains(label)) {
                return Result.failure(type.alreadyExists());
            }
        }

        Set<Long> assigned = new LinkedHashSet<>();
        for (String label : newLabels) {
            long id = nextId++;
            labelsById.put(id, label);
            labels.add(label);
            assigned.add(id);
        }

        rebuildSnapshot();
        return Result.success(Collections.unmodifiableSet(assigned));
    }

    /**
     * ID로 이름 조회
     */
    public Result<String> getLabel(long id) {
        String label = labelsById.get(id);
        if (label == null) {
            return Result.failure(type.notFound());
        }
        return Result.success(label);
    }

    public boolean has(long id) {
        return labelsById.containsKey(id);
    }

    /**
     * 전체 ID 오름차순 목록 (캐시 없음, 호출할 때마다 생성)
     */
    public List<Long> sortedIds() {
        return labelsById.keySet().stream()
                .sorted()
                .toList();
    }

    /**
     * "id,label" 줄 목록 (캐시)
     */
    public Snapshot snapshot() {
        return snapshot;
    }

    public int size() {
        return labelsById.size();
    }

    /**
     * 전체 초기화, 다음 등록은 ID 1부터 시작
     */
    public void clear() {
        labelsById.clear();
        labels.clear();
        nextId = FIRST_ID;
        rebuildSnapshot();
    }

    private void rebuildSnapshot() {
        StringBuilder sb = new StringBuilder();
        labelsById.forEach((id, label) -> sb.append(id)
                .append(',')
                .append(label)
                .append(Snapshot.LINE_TERMINATOR));
        snapshot = snapshot.next(sb.toString());
    }

    private void validateLabels(Set<String> newLabels) {
        if (newLabels == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Labels cannot be null");
        }
        for (String label : newLabels) {
            if (label == null) {
                throw new BusinessException(ErrorCode.INVALID_INPUT,
                        String.format("%s label cannot be null", type));
            }
            // 목록의 줄 구분자(CRLF)만 금지, 단독 CR/LF와 빈 문자열은 허용
            if (label.contains(Snapshot.LINE_TERMINATOR)) {
                throw new BusinessException(ErrorCode.INVALID_INPUT,
                        String.format("%s label cannot contain the line terminator: %s",
                                type, label.replace(Snapshot.LINE_TERMINATOR, "\\r\\n")));
            }
        }
    }
}
