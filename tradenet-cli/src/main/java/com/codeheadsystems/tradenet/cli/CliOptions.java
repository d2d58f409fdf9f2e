package com.codeheadsystems.tradenet.cli;

import com.codeheadsystems.tradenet.client.config.TradeClientConfig;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed command line of {@link TradeNetCli}.
 *
 * @param command    the command
 * @param arguments  positional arguments after the command
 * @param server     the server base URL
 * @param ticketHex  the identity ticket as hex
 * @param playerName the player display name
 * @param saveDir    directory holding the token cache
 * @param timeout    the request timeout
 * @param noCache    keep the token in memory only
 * @param currency   starting currency balance for the local inventory
 */
public record CliOptions(String command,
                         List<String> arguments,
                         URI server,
                         String ticketHex,
                         String playerName,
                         Path saveDir,
                         Duration timeout,
                         boolean noCache,
                         int currency) {

  static final String DEFAULT_PLAYER = "player";
  static final Path DEFAULT_SAVE_DIR = Path.of(System.getProperty("user.home"), ".tradenet");

  /**
   * Parses the arguments.
   *
   * @param args the args
   * @return the cli options
   * @throws IllegalArgumentException when the arguments are incomplete or malformed
   */
  public static CliOptions parse(final String[] args) {
    URI server = TradeClientConfig.DEVELOPMENT_SERVER;
    String ticket = null;
    String player = DEFAULT_PLAYER;
    Path saveDir = DEFAULT_SAVE_DIR;
    Duration timeout = TradeClientConfig.DEFAULT_REQUEST_TIMEOUT;
    boolean noCache = false;
    int currency = 0;
    List<String> positional = new ArrayList<>();

    for (int i = 0; i < args.length; i++) {
      switch (args[i]) {
        case "--server"   -> server   = URI.create(value(args, ++i));
        case "--ticket"   -> ticket   = value(args, ++i);
        case "--player"   -> player   = value(args, ++i);
        case "--save-dir" -> saveDir  = Path.of(value(args, ++i));
        case "--timeout"  -> timeout  = Duration.ofSeconds(Long.parseLong(value(args, ++i)));
        case "--currency" -> currency = Integer.parseInt(value(args, ++i));
        case "--no-cache" -> noCache  = true;
        default           -> positional.add(args[i]);
      }
    }
    if (positional.isEmpty()) {
      throw new IllegalArgumentException("No command given");
    }
    if (ticket == null || ticket.isBlank()) {
      throw new IllegalArgumentException("--ticket is required");
    }
    return new CliOptions(positional.get(0), List.copyOf(positional.subList(1, positional.size())),
        server, ticket, player, saveDir, timeout, noCache, currency);
  }

  private static String value(final String[] args, final int index) {
    if (index >= args.length) {
      throw new IllegalArgumentException("Missing value for " + args[index - 1]);
    }
    return args[index];
  }

  /**
   * Client configuration for these options.
   *
   * @return the trade client config
   */
  public TradeClientConfig clientConfig() {
    return TradeClientConfig.forServer(server).withRequestTimeout(timeout);
  }

  /**
   * Integer positional argument.
   *
   * @param position index into {@link #arguments()}
   * @param name     name used in the error message
   * @return the int
   */
  public int intArgument(final int position, final String name) {
    if (position >= arguments.size()) {
      throw new IllegalArgumentException(command + " requires <" + name + ">");
    }
    try {
      return Integer.parseInt(arguments.get(position));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("<" + name + "> must be a number: " + arguments.get(position), e);
    }
  }
}
