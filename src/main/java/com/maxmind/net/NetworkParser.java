package com.maxmind.net;

import java.net.InetAddress;
import java.util.Arrays;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Recognizes the textual forms of a network:
 *
 * <ul>
 *     <li>{@code 192.168.0.1/24} or {@code 192.168.0.1 24}</li>
 *     <li>{@code 192.168.0.1 255.255.255.0}</li>
 *     <li>{@code 192.168.0.1}, with the prefix length supplied by a
 *     {@link CidrGuess}</li>
 * </ul>
 *
 * <p>When sanitizing, every character that cannot appear in an address or
 * separator is removed and runs of whitespace are collapsed before parsing, so
 * {@code "192.168.0.1 - 255.255.255.0"} is also accepted.</p>
 *
 * <p>Every {@code parse} method throws a {@link NetworkException} describing
 * the failure; the matching {@code tryParse} method returns an empty
 * {@link Optional} instead. Instances are immutable and thread-safe.</p>
 */
public final class NetworkParser {

    static final NetworkParser DEFAULT = new NetworkParser();

    private static final Pattern DISALLOWED = Pattern.compile("[^0-9a-fA-F./\\s:]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SEPARATOR = Pattern.compile("[ /]");
    // Anything that fits in an unsigned byte is read as a prefix length.
    private static final Pattern PREFIX_TOKEN = Pattern.compile("\\d{1,3}");
    private static final int MAX_PREFIX_TOKEN = 255;

    private final CidrGuess cidrGuess;
    private final boolean sanitize;

    /**
     * Constructs a sanitizing parser that guesses missing prefix lengths from
     * the legacy address class.
     */
    public NetworkParser() {
        this(ClassfulCidrGuess.getInstance());
    }

    /**
     * Constructs a sanitizing parser with the specified guess strategy.
     *
     * @param cidrGuess the strategy used for input without a prefix length
     */
    public NetworkParser(CidrGuess cidrGuess) {
        this(cidrGuess, true);
    }

    /**
     * @param cidrGuess the strategy used for input without a prefix length
     * @param sanitize  whether to strip characters that cannot appear in an
     *                  address before parsing
     */
    public NetworkParser(CidrGuess cidrGuess, boolean sanitize) {
        if (cidrGuess == null) {
            throw new NullPointerException("CidrGuess cannot be null");
        }
        this.cidrGuess = cidrGuess;
        this.sanitize = sanitize;
    }

    /**
     * @return the strategy used for input without a prefix length.
     */
    public CidrGuess cidrGuess() {
        return cidrGuess;
    }

    /**
     * @return whether input is sanitized before parsing.
     */
    public boolean isSanitizing() {
        return sanitize;
    }

    /**
     * @param network the network text
     * @return the network.
     * @throws EmptyInputException        if the text is null or empty.
     * @throws MalformedAddressException  if the address part is not an address.
     * @throws MalformedNetmaskException  if the netmask part is not an address.
     * @throws InvalidNetmaskException    if the netmask is not contiguous.
     * @throws PrefixOutOfRangeException if the prefix length is too long.
     * @throws UnguessableLengthException if no prefix length was given and
     *                                    none could be guessed.
     */
    public Network parse(String network) {
        return parseNetwork(network).getOrThrow();
    }

    /**
     * @param network the network text
     * @return the network, or empty if the text is not a network.
     */
    public Optional<Network> tryParse(String network) {
        return parseNetwork(network).toOptional();
    }

    /**
     * @param address an address literal
     * @param netmask a netmask literal such as {@code 255.255.255.0}
     * @return the network.
     * @throws NetworkException if either part is missing or invalid.
     */
    public Network parse(String address, String netmask) {
        return parseWithNetmask(address, netmask).getOrThrow();
    }

    /**
     * @param address an address literal
     * @param netmask a netmask literal such as {@code 255.255.255.0}
     * @return the network, or empty if either part is missing or invalid.
     */
    public Optional<Network> tryParse(String address, String netmask) {
        return parseWithNetmask(address, netmask).toOptional();
    }

    /**
     * @param address      an address literal
     * @param prefixLength the prefix length
     * @return the network.
     * @throws NetworkException if the address or prefix length is invalid.
     */
    public Network parse(String address, int prefixLength) {
        return parseWithPrefixLength(address, prefixLength).getOrThrow();
    }

    /**
     * @param address      an address literal
     * @param prefixLength the prefix length
     * @return the network, or empty if the address or prefix length is
     *         invalid.
     */
    public Optional<Network> tryParse(String address, int prefixLength) {
        return parseWithPrefixLength(address, prefixLength).toOptional();
    }

    Result<Network> parseNetwork(String network) {
        if (network == null || network.isEmpty()) {
            return Result.fail(() -> new EmptyInputException("network"));
        }
        String text = sanitize ? sanitize(network) : network;
        if (text.isEmpty()) {
            return Result.fail(() -> new EmptyInputException("network"));
        }

        String[] tokens = SEPARATOR.split(text, -1);
        if (sanitize) {
            tokens = Arrays.stream(tokens).filter(t -> !t.isEmpty()).toArray(String[]::new);
        }

        if (tokens.length == 1) {
            return parseWithGuess(tokens[0]);
        }
        if (tokens.length > 2) {
            return Result.fail(() -> new MalformedAddressException(network,
                "expected an address followed by a prefix length or netmask"));
        }
        if (isPrefixToken(tokens[1])) {
            return parseWithPrefixLength(tokens[0], Integer.parseInt(tokens[1]));
        }
        return parseWithNetmask(tokens[0], tokens[1]);
    }

    Result<Network> parseWithPrefixLength(String address, int prefixLength) {
        return AddressCodec.parseAddress(address).flatMap(ip -> Network.create(
            AddressCodec.toBigInteger(ip), AddressFamily.of(ip), prefixLength));
    }

    Result<Network> parseWithNetmask(String address, String netmask) {
        if (address == null || address.isEmpty()) {
            return Result.fail(() -> new EmptyInputException("address"));
        }
        if (netmask == null || netmask.isEmpty()) {
            return Result.fail(() -> new EmptyInputException("netmask"));
        }
        Result<InetAddress> ip = AddressCodec.parseAddress(address);
        if (!ip.isPresent()) {
            return Result.fail(() -> new MalformedAddressException(address));
        }
        Optional<InetAddress> mask = AddressCodec.tryParse(netmask);
        if (mask.isEmpty()) {
            return Result.fail(() -> new MalformedNetmaskException(netmask));
        }
        return Network.create(ip.getOrThrow(), mask.get());
    }

    private Result<Network> parseWithGuess(String address) {
        Result<InetAddress> ip = AddressCodec.parseAddress(address);
        if (!ip.isPresent()) {
            return Result.fail(() -> new MalformedAddressException(address));
        }
        OptionalInt guessed = cidrGuess.tryGuess(address);
        if (guessed.isEmpty()) {
            return Result.fail(() -> new UnguessableLengthException(address));
        }
        return parseWithPrefixLength(address, guessed.getAsInt());
    }

    private static boolean isPrefixToken(String token) {
        return PREFIX_TOKEN.matcher(token).matches() && Integer.parseInt(token) <= MAX_PREFIX_TOKEN;
    }

    static String sanitize(String network) {
        String stripped = DISALLOWED.matcher(network).replaceAll("");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }
}
