package io.parareq.openai;

@FunctionalInterface
public interface TokenCounter {
    int count(String text);
}
