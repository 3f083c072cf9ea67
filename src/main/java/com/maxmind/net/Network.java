package com.maxmind.net;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.math.BigInteger;
import java.net.InetAddress;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code Network} represents an IPv4 or IPv6 network in CIDR form.
 *
 * <p>A network is the triple of its family, its network address and its
 * prefix length. Host bits of the address used to build it are always
 * cleared, so {@code 192.168.168.100/24} and {@code 192.168.168.0/24} are the
 * same network. Instances are immutable and safe to share between threads.</p>
 *
 * <p>Networks are ordered by family, then network address, then prefix
 * length.</p>
 */
public final class Network implements Comparable<Network> {

    /**
     * The private-use block {@code 10.0.0.0/8}.
     */
    public static final Network IANA_A_BLOCK =
        new Network(BigInteger.valueOf(0x0A000000L), AddressFamily.IPV4, 8);

    /**
     * The private-use block {@code 172.16.0.0/12}.
     */
    public static final Network IANA_B_BLOCK =
        new Network(BigInteger.valueOf(0xAC100000L), AddressFamily.IPV4, 12);

    /**
     * The private-use block {@code 192.168.0.0/16}.
     */
    public static final Network IANA_C_BLOCK =
        new Network(BigInteger.valueOf(0xC0A80000L), AddressFamily.IPV4, 16);

    private final BigInteger network;
    private final int prefixLength;
    private final AddressFamily family;
    private final int hashCode;

    private final Object broadcastLock = new Object();
    private volatile BigInteger cachedBroadcast;

    /**
     * Constructs the zero network, {@code 0.0.0.0/0}.
     */
    public Network() {
        this(BigInteger.ZERO, AddressFamily.IPV4, 0);
    }

    /**
     * Constructs a network from any address within it and a prefix length.
     *
     * @param address      An IP address in the network. This does not have to
     *                     be the first address in the network.
     * @param prefixLength The number of leading 1 bits in the netmask.
     * @throws PrefixOutOfRangeException if the prefix length does not fit the
     *                                   address family.
     */
    public Network(InetAddress address, int prefixLength) {
        this(AddressCodec.toBigInteger(address), AddressFamily.of(address), prefixLength);
    }

    /**
     * Constructs a network from any address within it and a netmask.
     *
     * @param address An IP address in the network.
     * @param netmask The netmask, e.g. {@code 255.255.255.0}.
     * @throws MixedAddressFamilyException if the netmask is not of the
     *                                     address's family.
     * @throws InvalidNetmaskException     if the netmask is not a contiguous
     *                                     run of leading 1 bits.
     */
    public Network(InetAddress address, InetAddress netmask) {
        this(address, create(address, netmask).getOrThrow().prefixLength);
    }

    Network(BigInteger address, AddressFamily family, int prefixLength) {
        if (family == null) {
            throw new NullPointerException("Address family cannot be null");
        }
        this.network = address.and(PrefixMath.netmask(prefixLength, family));
        this.prefixLength = prefixLength;
        this.family = family;
        this.hashCode = Objects.hash(family, network, prefixLength);
    }

    /**
     * @param address      An IP address in the network.
     * @param prefixLength The number of leading 1 bits in the netmask.
     * @return the network, or empty if the prefix length does not fit the
     *         address family.
     */
    public static Optional<Network> tryOf(InetAddress address, int prefixLength) {
        return create(AddressCodec.toBigInteger(address), AddressFamily.of(address), prefixLength)
            .toOptional();
    }

    /**
     * @param address An IP address in the network.
     * @param netmask The netmask, e.g. {@code 255.255.255.0}.
     * @return the network, or empty if the netmask is invalid or of another
     *         family.
     */
    public static Optional<Network> tryOf(InetAddress address, InetAddress netmask) {
        return create(address, netmask).toOptional();
    }

    static Result<Network> create(BigInteger address, AddressFamily family, int prefixLength) {
        if (!PrefixMath.isPrefixLengthInRange(prefixLength, family)) {
            return Result.fail(() -> new PrefixOutOfRangeException(prefixLength, family));
        }
        return Result.of(new Network(address, family, prefixLength));
    }

    static Result<Network> create(InetAddress address, InetAddress netmask) {
        if (address == null) {
            return Result.fail(() -> new EmptyInputException("address"));
        }
        if (netmask == null) {
            return Result.fail(() -> new EmptyInputException("netmask"));
        }
        AddressFamily family = AddressFamily.of(address);
        AddressFamily maskFamily = AddressFamily.of(netmask);
        if (family != maskFamily) {
            return Result.fail(() -> new MixedAddressFamilyException(family, maskFamily));
        }
        BigInteger value = AddressCodec.toBigInteger(address);
        return PrefixMath.computeCidr(AddressCodec.toBigInteger(netmask), family)
            .flatMap(cidr -> create(value, family, cidr));
    }

    // Parsing entry points. The grammar lives in NetworkParser.

    /**
     * Parses {@code address/prefix}, {@code address prefix},
     * {@code address netmask} or a bare address whose prefix length is guessed
     * from its class. The input is sanitized first.
     *
     * @param network the network text, e.g. {@code 192.168.0.1/24}
     * @return the network.
     * @throws NetworkException if the text is not a network.
     */
    public static Network parse(String network) {
        return NetworkParser.DEFAULT.parse(network);
    }

    /**
     * @param network  the network text
     * @param sanitize whether to strip characters that cannot appear in an
     *                 address before parsing
     * @return the network.
     * @throws NetworkException if the text is not a network.
     */
    public static Network parse(String network, boolean sanitize) {
        return new NetworkParser(ClassfulCidrGuess.getInstance(), sanitize).parse(network);
    }

    /**
     * @param network   the network text
     * @param cidrGuess the strategy used when the text has no prefix length
     * @return the network.
     * @throws NetworkException if the text is not a network.
     */
    public static Network parse(String network, CidrGuess cidrGuess) {
        return new NetworkParser(cidrGuess).parse(network);
    }

    /**
     * @param network   the network text
     * @param cidrGuess the strategy used when the text has no prefix length
     * @param sanitize  whether to sanitize the text before parsing
     * @return the network.
     * @throws NetworkException if the text is not a network.
     */
    public static Network parse(String network, CidrGuess cidrGuess, boolean sanitize) {
        return new NetworkParser(cidrGuess, sanitize).parse(network);
    }

    /**
     * @param address an address literal
     * @param netmask a netmask literal such as {@code 255.255.255.0}
     * @return the network.
     * @throws NetworkException if either part is invalid.
     */
    public static Network parse(String address, String netmask) {
        return NetworkParser.DEFAULT.parse(address, netmask);
    }

    /**
     * @param address      an address literal
     * @param prefixLength the prefix length
     * @return the network.
     * @throws NetworkException if the address or prefix length is invalid.
     */
    public static Network parse(String address, int prefixLength) {
        return NetworkParser.DEFAULT.parse(address, prefixLength);
    }

    /**
     * @param network the network text
     * @return the network, or empty if the text is not a network.
     */
    public static Optional<Network> tryParse(String network) {
        return NetworkParser.DEFAULT.tryParse(network);
    }

    /**
     * @param network  the network text
     * @param sanitize whether to sanitize the text before parsing
     * @return the network, or empty if the text is not a network.
     */
    public static Optional<Network> tryParse(String network, boolean sanitize) {
        return new NetworkParser(ClassfulCidrGuess.getInstance(), sanitize).tryParse(network);
    }

    /**
     * @param network   the network text
     * @param cidrGuess the strategy used when the text has no prefix length
     * @return the network, or empty if the text is not a network.
     */
    public static Optional<Network> tryParse(String network, CidrGuess cidrGuess) {
        return new NetworkParser(cidrGuess).tryParse(network);
    }

    /**
     * @param network   the network text
     * @param cidrGuess the strategy used when the text has no prefix length
     * @param sanitize  whether to sanitize the text before parsing
     * @return the network, or empty if the text is not a network.
     */
    public static Optional<Network> tryParse(String network, CidrGuess cidrGuess, boolean sanitize) {
        return new NetworkParser(cidrGuess, sanitize).tryParse(network);
    }

    /**
     * @param address an address literal
     * @param netmask a netmask literal
     * @return the network, or empty if either part is invalid.
     */
    public static Optional<Network> tryParse(String address, String netmask) {
        return NetworkParser.DEFAULT.tryParse(address, netmask);
    }

    /**
     * @param address      an address literal
     * @param prefixLength the prefix length
     * @return the network, or empty if the address or prefix length is
     *         invalid.
     */
    public static Optional<Network> tryParse(String address, int prefixLength) {
        return NetworkParser.DEFAULT.tryParse(address, prefixLength);
    }

    // Accessors

    /**
     * @return the address family.
     */
    public AddressFamily family() {
        return family;
    }

    /**
     * @return the number of leading 1 bits in the netmask.
     */
    public int prefixLength() {
        return prefixLength;
    }

    /**
     * @return The first address in the network.
     */
    public InetAddress networkAddress() {
        return AddressCodec.fromBigInteger(network, family);
    }

    /**
     * @return the netmask, e.g. {@code 255.255.255.0} for a /24.
     */
    public InetAddress netmask() {
        return AddressCodec.fromBigInteger(netmaskValue(), family);
    }

    /**
     * @return the wildcard mask, the complement of the netmask, e.g.
     *         {@code 0.0.0.255} for a /24.
     */
    public InetAddress wildcardMask() {
        return AddressCodec.fromBigInteger(PrefixMath.wildcardMask(prefixLength, family), family);
    }

    /**
     * @return the broadcast address, or {@code null} for an IPv6 network,
     *         which has none. See {@link #lastAddress()}.
     */
    public InetAddress broadcast() {
        if (family == AddressFamily.IPV6) {
            return null;
        }
        return lastAddress();
    }

    /**
     * @return the last address in the network.
     */
    public InetAddress lastAddress() {
        return AddressCodec.fromBigInteger(broadcastValue(), family);
    }

    /**
     * @return the first host address. This is the network address itself for
     *         IPv6 and for IPv4 networks without usable addresses.
     */
    public InetAddress firstUsable() {
        BigInteger first = family == AddressFamily.IPV6 || usable().signum() <= 0
            ? network
            : network.add(BigInteger.ONE);
        return AddressCodec.fromBigInteger(first, family);
    }

    /**
     * @return the last host address. This is the last address for IPv6, and
     *         the network address for IPv4 networks without usable addresses.
     */
    public InetAddress lastUsable() {
        BigInteger last;
        if (family == AddressFamily.IPV6) {
            last = broadcastValue();
        } else if (usable().signum() <= 0) {
            last = network;
        } else {
            last = broadcastValue().subtract(BigInteger.ONE);
        }
        return AddressCodec.fromBigInteger(last, family);
    }

    /**
     * @return the number of usable host addresses.
     */
    public BigInteger usable() {
        return PrefixMath.usableCount(prefixLength, family);
    }

    /**
     * @return the number of addresses in the network.
     */
    public BigInteger total() {
        return PrefixMath.totalCount(prefixLength, family);
    }

    BigInteger value() {
        return network;
    }

    BigInteger netmaskValue() {
        return PrefixMath.netmask(prefixLength, family);
    }

    BigInteger broadcastValue() {
        BigInteger cached = cachedBroadcast;
        if (cached != null) {
            return cached;
        }
        synchronized (broadcastLock) {
            if (cachedBroadcast == null) {
                cachedBroadcast = PrefixMath.broadcast(network, netmaskValue(), family);
            }
            return cachedBroadcast;
        }
    }

    // Predicates

    /**
     * @param address an IP address
     * @return whether the address lies within this network. Addresses of the
     *         other family are never contained.
     */
    public boolean contains(InetAddress address) {
        if (address == null) {
            throw new NullPointerException("Address cannot be null");
        }
        if (AddressFamily.of(address) != family) {
            return false;
        }
        BigInteger value = AddressCodec.toBigInteger(address);
        return value.compareTo(network) >= 0 && value.compareTo(broadcastValue()) <= 0;
    }

    /**
     * @param other another network
     * @return whether every address of the other network lies within this
     *         one. Networks of the other family are never contained.
     */
    public boolean contains(Network other) {
        if (other == null) {
            throw new NullPointerException("Network cannot be null");
        }
        if (other.family != family) {
            return false;
        }
        return other.network.compareTo(network) >= 0
            && other.broadcastValue().compareTo(broadcastValue()) <= 0;
    }

    /**
     * @param other another network
     * @return whether the two networks share at least one address.
     */
    public boolean overlaps(Network other) {
        if (other == null) {
            throw new NullPointerException("Network cannot be null");
        }
        if (other.family != family) {
            return false;
        }
        BigInteger first = other.network;
        BigInteger last = other.broadcastValue();
        BigInteger broadcast = broadcastValue();
        return (first.compareTo(network) >= 0 && first.compareTo(broadcast) <= 0)
            || (last.compareTo(network) >= 0 && last.compareTo(broadcast) <= 0)
            || (first.compareTo(network) <= 0 && last.compareTo(broadcast) >= 0);
    }

    /**
     * @return whether this network lies entirely within one of the IANA
     *         private-use blocks.
     */
    public boolean isIanaReserved() {
        return IANA_A_BLOCK.contains(this)
            || IANA_B_BLOCK.contains(this)
            || IANA_C_BLOCK.contains(this);
    }

    /**
     * @param address an IP address
     * @return whether the address lies within one of the IANA private-use
     *         blocks.
     */
    public static boolean isIanaReserved(InetAddress address) {
        return IANA_A_BLOCK.contains(address)
            || IANA_B_BLOCK.contains(address)
            || IANA_C_BLOCK.contains(address);
    }

    // Splitting, merging and enumeration

    /**
     * @param prefixLength the prefix length of the subnets
     * @return a lazy view of the {@code 2^(prefixLength - prefixLength())}
     *         subnets in ascending order.
     * @throws InvalidSplitException if the prefix length is shorter than this
     *                               network's or longer than the family allows.
     */
    public NetworkRange subnet(int prefixLength) {
        return Subnetter.subnet(this, prefixLength);
    }

    /**
     * @param prefixLength the prefix length of the subnets
     * @return the subnets, or empty if the prefix length is invalid.
     */
    public Optional<NetworkRange> trySubnet(int prefixLength) {
        return Subnetter.trySubnet(this, prefixLength);
    }

    /**
     * @param other a network adjacent to or overlapping this one
     * @return the smallest network covering both.
     * @throws NetworkException if the networks cannot be merged.
     * @see Supernetter#supernet(Network, Network)
     */
    public Network supernet(Network other) {
        return Supernetter.supernet(this, other);
    }

    /**
     * @param other a network adjacent to or overlapping this one
     * @return the smallest network covering both, or empty if they cannot be
     *         merged.
     */
    public Optional<Network> trySupernet(Network other) {
        return Supernetter.trySupernet(this, other);
    }

    /**
     * @return a lazy view of every address in the network.
     */
    public AddressRange listAddresses() {
        return listAddresses(AddressFilter.ALL);
    }

    /**
     * @param filter which addresses to include
     * @return a lazy view of the matching addresses in ascending order.
     */
    public AddressRange listAddresses(AddressFilter filter) {
        return new AddressRange(this, filter);
    }

    // Object methods

    /**
     * @return a multi-line, human-readable description of the network. This
     *         is not a serialization format.
     */
    public String print() {
        StringWriter out = new StringWriter();
        try (PrintWriter writer = new PrintWriter(out)) {
            writer.printf("IPNetwork   : %s%n", this);
            writer.printf("Network     : %s%n", AddressCodec.toString(networkAddress()));
            writer.printf("Netmask     : %s%n", AddressCodec.toString(netmask()));
            writer.printf("Cidr        : %d%n", prefixLength);
            InetAddress broadcast = broadcast();
            writer.printf("Broadcast   : %s%n", broadcast == null ? "" : AddressCodec.toString(broadcast));
            writer.printf("FirstUsable : %s%n", AddressCodec.toString(firstUsable()));
            writer.printf("LastUsable  : %s%n", AddressCodec.toString(lastUsable()));
            writer.printf("Usable      : %s%n", usable());
        }
        return out.toString();
    }

    /**
     * @return A string representation of the network in CIDR notation, e.g.,
     *         {@code 1.2.3.0/24} or {@code 2001:db8::/32}. The string parses
     *         back to an equal network.
     */
    @Override
    public String toString() {
        return AddressCodec.toString(networkAddress()) + "/" + prefixLength;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Network)) {
            return false;
        }
        Network other = (Network) o;
        return family == other.family
            && prefixLength == other.prefixLength
            && network.equals(other.network);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public int compareTo(Network other) {
        int result = family.compareTo(other.family);
        if (result != 0) {
            return result;
        }
        result = network.compareTo(other.network);
        if (result != 0) {
            return result;
        }
        return Integer.compare(prefixLength, other.prefixLength);
    }
}
