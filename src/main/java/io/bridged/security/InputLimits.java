package io.bridged.security;

public record InputLimits(
        int maxStringLength,
        int maxCollectionLength,
        int maxDepth,
        int maxParamCount
) {
}
