package com.maxmind.net;

/**
 * Selects which addresses of a network {@link Network#listAddresses(AddressFilter)}
 * returns.
 */
public enum AddressFilter {
    /**
     * Every address in the network.
     */
    ALL,
    /**
     * The host addresses from {@link Network#firstUsable()} to
     * {@link Network#lastUsable()}. For IPv4 /31 and /32 networks there are
     * none. For IPv6 this is every address.
     */
    USABLE,
    /**
     * The IPv4 addresses that are not usable: the network and broadcast
     * addresses, or every address of a /31 or /32. Empty for IPv6.
     */
    UNUSABLE,
    /**
     * The IPv4 broadcast address. Empty for IPv6.
     */
    BROADCAST,
    /**
     * The network address.
     */
    NETWORK
}
