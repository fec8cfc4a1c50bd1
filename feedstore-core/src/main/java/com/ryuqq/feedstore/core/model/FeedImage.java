package com.ryuqq.feedstore.core.model;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.UUID;

/**
 * 피드 이미지 한 건의 메타데이터.
 *
 * <p>캐시 슬롯에 저장되는 최소 단위이며, 필드 간 파생 관계는 없습니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가 (record)</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>id: null 불가</li>
 *   <li>description, location: null 허용</li>
 *   <li>url: null 불가, 절대 경로이며 URL로 변환 가능해야 함</li>
 * </ul>
 *
 * @param id 이미지 고유 식별자
 * @param description 설명 (선택, null 가능)
 * @param location 위치 (선택, null 가능)
 * @param url 이미지 원본 URL
 *
 * @author FeedStore Team
 * @since 1.0.0
 */
public record FeedImage(
    UUID id,
    String description,
    String location,
    URI url
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id 또는 url이 null이거나 url이 유효한 URL이 아닌 경우
     */
    public FeedImage {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (url == null) {
            throw new IllegalArgumentException("url cannot be null");
        }
        if (!url.isAbsolute()) {
            throw new IllegalArgumentException("url must be absolute (current: " + url + ")");
        }
        try {
            url.toURL();
        } catch (MalformedURLException | IllegalArgumentException e) {
            throw new IllegalArgumentException("url is not a valid URL (current: " + url + ")", e);
        }
    }

    /**
     * 문자열 값으로 FeedImage 생성.
     *
     * @param id UUID 문자열
     * @param description 설명 (null 허용)
     * @param location 위치 (null 허용)
     * @param url URL 문자열
     * @return FeedImage 인스턴스
     * @throws IllegalArgumentException id 또는 url이 유효하지 않은 경우
     */
    public static FeedImage of(String id, String description, String location, String url) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url cannot be null or blank");
        }

        UUID uuid;
        try {
            uuid = UUID.fromString(id);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("id is not a valid UUID (current: " + id + ")", e);
        }

        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("url is not a valid URL (current: " + url + ")", e);
        }

        return new FeedImage(uuid, description, location, uri);
    }
}
