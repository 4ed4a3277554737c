package net.visitorpool.core.model;

/**
 * 풀 현황 스냅샷.
 * free = total - allocated, expired 는 회수 지연 관찰용으로 별도 집계.
 */
public record PoolStatus(int total, int allocated, int free, int expired) {
}
