package com.healthtech.olap.data.star;

public record ProviderDimension(int providerKey, int providerId, String fullName, String credential) {
}
