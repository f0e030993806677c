package com.rsl.retrieval.document;

public record DocumentVectorHit(String id, String title, String description, double similarity) {
}
