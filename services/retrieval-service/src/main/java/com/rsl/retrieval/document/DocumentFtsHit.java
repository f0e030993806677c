package com.rsl.retrieval.document;

public record DocumentFtsHit(String id, String title, String description, double rank, String snippet) {
}
