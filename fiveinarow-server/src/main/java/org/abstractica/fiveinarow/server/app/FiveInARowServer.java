package org.abstractica.fiveinarow.server.app;

import org.abstractica.fiveinarow.engine.GameSnapshot;
import org.abstractica.fiveinarow.server.Server;
import org.abstractica.fiveinarow.server.ServerStats;
import org.abstractica.fiveinarow.server.session.DefaultServerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;

/**
 * Console entry point for the five-in-a-row server.
 *
 * <p>The listen address is taken from the first argument, or asked for on
 * standard input. Once running, the console accepts a few operator
 * commands.</p>
 */
public class FiveInARowServer
{
    private static final Logger LOG = LoggerFactory.getLogger(FiveInARowServer.class);

    static final String DEFAULT_ADDRESS = "0.0.0.0:3333";
    static final String ADDRESS_PROMPT = "Enter desired IP or leave it blank to keep a default value:";

    private final Server server;

    public FiveInARowServer(ListenAddress address)
    {
        InetAddress bindAddress;
        try
        {
            bindAddress = InetAddress.getByName(address.host());
        }
        catch (UnknownHostException e)
        {
            throw new IllegalArgumentException("Unknown host: " + address.host(), e);
        }

        this.server = new DefaultServerFactory().builder()
                .bindAddress(bindAddress)
                .port(address.port())
                .build();
    }

    /**
     * A host and port to listen on.
     *
     * @param host host name or IP literal
     * @param port port number, 0-65535
     */
    public record ListenAddress(String host, int port)
    {
        @Override
        public String toString()
        {
            return host + ":" + port;
        }
    }

    /**
     * Parses {@code host:port}. The last colon separates the port, so IPv6
     * literals in brackets work as well.
     *
     * @param text the address text
     * @return the parsed address
     * @throws IllegalArgumentException if the text is not a valid address
     */
    static ListenAddress parseAddress(String text)
    {
        String trimmed = text.trim();
        int colon = trimmed.lastIndexOf(':');
        if (colon <= 0 || colon == trimmed.length() - 1)
        {
            throw new IllegalArgumentException("Expected host:port but got '" + text + "'");
        }

        String host = trimmed.substring(0, colon);
        if (host.startsWith("[") && host.endsWith("]"))
        {
            host = host.substring(1, host.length() - 1);
        }

        int port;
        try
        {
            port = Integer.parseInt(trimmed.substring(colon + 1));
        }
        catch (NumberFormatException e)
        {
            throw new IllegalArgumentException("Invalid port in '" + text + "'", e);
        }
        if (port < 0 || port > 65535)
        {
            throw new IllegalArgumentException("Port must be 0-65535: " + port);
        }
        return new ListenAddress(host, port);
    }

    /**
     * Chooses the listen address from the command line or the console.
     *
     * @param args    program arguments
     * @param console console input, used when no argument is given
     * @return the address to listen on
     * @throws IOException if reading the console fails
     */
    static ListenAddress resolveAddress(String[] args, BufferedReader console) throws IOException
    {
        if (args.length > 0)
        {
            return parseAddress(args[0]);
        }

        System.out.println(ADDRESS_PROMPT);
        String line = console.readLine();
        if (line == null || line.isBlank())
        {
            return parseAddress(DEFAULT_ADDRESS);
        }
        return parseAddress(line);
    }

    public void start()
    {
        server.start();
        LOG.info("Five-in-a-row server listening on {}", server.getLocalAddress());
    }

    public void stop()
    {
        server.close();
        LOG.info("Five-in-a-row server stopped");
    }

    public void runCommandLoop(BufferedReader reader)
    {
        System.out.println("Server commands: status, board, reset, quit");

        try
        {
            String line;
            while ((line = reader.readLine()) != null)
            {
                String command = line.trim().toLowerCase();

                switch (command)
                {
                    case "status" -> printStatus();
                    case "board" -> printBoard();
                    case "reset" ->
                    {
                        server.resetGame();
                        System.out.println("Game reset");
                    }
                    case "quit", "exit", "q" ->
                    {
                        System.out.println("Shutting down...");
                        return;
                    }
                    case "" ->
                    {
                        // Ignore empty input
                    }
                    default -> System.out.println("Unknown command: " + command);
                }
            }
        }
        catch (IOException e)
        {
            LOG.error("Error reading console input", e);
        }
    }

    private void printStatus()
    {
        ServerStats stats = server.getStats();
        GameSnapshot snapshot = server.snapshot();

        System.out.printf("Connections: %d active, %d accepted%n",
                stats.getActiveConnections(), stats.getTotalConnections());
        System.out.printf("Commands: %d processed, %d rejected, %d protocol errors%n",
                stats.getCommandsProcessed(), stats.getRejectedCommands(), stats.getProtocolErrors());
        System.out.println("Phase: " + snapshot.phase());
        for (GameSnapshot.PlayerView player : snapshot.players())
        {
            System.out.printf("  %s (%s)%s%s%n",
                    player.name(),
                    player.peer(),
                    player.color().isPresent() ? " color " + player.color().getAsInt() : "",
                    player.seated() ? "" : " [not seated]");
        }
        snapshot.activePlayer().ifPresent(name -> System.out.println("To move: " + name));
        snapshot.winner().ifPresent(name -> System.out.println("Winner: " + name));
    }

    private void printBoard()
    {
        System.out.print(server.snapshot().render());
    }

    public static void main(String[] args)
    {
        BufferedReader console = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));

        ListenAddress address;
        try
        {
            address = resolveAddress(args, console);
        }
        catch (IOException e)
        {
            throw new UncheckedIOException("Could not read the listen address", e);
        }
        catch (IllegalArgumentException e)
        {
            System.err.println(e.getMessage());
            System.exit(1);
            return;
        }

        FiveInARowServer app = new FiveInARowServer(address);
        app.start();

        app.runCommandLoop(console);

        app.stop();
    }
}
