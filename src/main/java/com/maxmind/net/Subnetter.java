package com.maxmind.net;

import java.util.Optional;

/**
 * Splits a network into equally sized subnets.
 */
public final class Subnetter {

    private Subnetter() {
    }

    /**
     * @param network      the network to split
     * @param prefixLength the prefix length of the subnets, at least the
     *                     network's own and at most the family's width
     * @return a lazy, indexable view of the subnets in ascending order.
     * @throws InvalidSplitException if the prefix length is out of range.
     */
    public static NetworkRange subnet(Network network, int prefixLength) {
        return split(network, prefixLength).getOrThrow();
    }

    /**
     * @param network      the network to split
     * @param prefixLength the prefix length of the subnets
     * @return the subnets, or empty if the prefix length is out of range.
     */
    public static Optional<NetworkRange> trySubnet(Network network, int prefixLength) {
        return split(network, prefixLength).toOptional();
    }

    static Result<NetworkRange> split(Network network, int prefixLength) {
        if (network == null) {
            throw new NullPointerException("Network cannot be null");
        }
        if (prefixLength < network.prefixLength() || prefixLength > network.family().bitLength()) {
            return Result.fail(() -> new InvalidSplitException(network, prefixLength));
        }
        return Result.of(new NetworkRange(network, prefixLength));
    }
}
