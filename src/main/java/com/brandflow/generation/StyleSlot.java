package com.brandflow.generation;

/**
 * One requested style together with its already-built prompt.
 */
public record StyleSlot(String style, String prompt) {
}
