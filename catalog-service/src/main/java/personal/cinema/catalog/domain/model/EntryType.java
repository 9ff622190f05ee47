package personal.cinema.catalog.domain.model;

import personal.cinema.common.exception.ErrorCode;

/**
 * Entry Type Enum
 * 식별자 카탈로그가 관리하는 항목 종류와 그에 맞는 에러 코드
 */
public enum EntryType {
    MOVIE(ErrorCode.MOVIE_NOT_FOUND, ErrorCode.MOVIE_ALREADY_EXISTS),
    THEATER(ErrorCode.THEATER_NOT_FOUND, ErrorCode.THEATER_ALREADY_EXISTS);

    private final ErrorCode notFound;
    private final ErrorCode alreadyExists;

    EntryType(ErrorCode notFound, ErrorCode alreadyExists) {
        this.notFound = notFound;
        this.alreadyExists = alreadyExists;
    }

    public ErrorCode notFound() {
        return notFound;
    }

    public ErrorCode alreadyExists() {
        return alreadyExists;
    }
}
