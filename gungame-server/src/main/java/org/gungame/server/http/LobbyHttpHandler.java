package org.gungame.server.http;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import org.gungame.protocol.http.CreateLobbyRequest;
import org.gungame.protocol.http.ErrorResponse;
import org.gungame.protocol.http.JoinLobbyRequest;
import org.gungame.protocol.http.JoinLobbyResponse;
import org.gungame.protocol.http.LobbyInfo;
import org.gungame.protocol.serialization.MalformedMessageException;
import org.gungame.protocol.serialization.MessageCodec;
import org.gungame.server.config.ServerConfig;
import org.gungame.server.domain.ConflictException;
import org.gungame.server.domain.JoinResult;
import org.gungame.server.domain.LobbyDomain;
import org.gungame.server.domain.LobbyFullException;
import org.gungame.server.domain.LobbySnapshot;
import org.gungame.server.domain.NotFoundException;
import org.gungame.server.domain.ServerFullException;
import org.gungame.server.state.SharedState;
import org.gungame.server.stats.ServerStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.IntSupplier;
import java.util.function.LongSupplier;

/**
 * REST adapter over {@link LobbyDomain}.
 *
 * <p>Routes:</p>
 * <ul>
 *   <li>{@code GET /lobbies} lists lobbies</li>
 *   <li>{@code POST /lobbies} creates a lobby</li>
 *   <li>{@code GET /lobbies/{code}} describes one lobby</li>
 *   <li>{@code POST /lobbies/{code}/join} admits a player</li>
 *   <li>{@code GET /stats} returns server statistics</li>
 * </ul>
 *
 * <p>Requests are validated here before any domain call. Domain failures
 * map to 404, 409 or 503; every other validation failure is a 400.</p>
 */
public class LobbyHttpHandler implements HttpHandler
{
    private static final Logger LOG = LoggerFactory.getLogger(LobbyHttpHandler.class);

    private static final String LOBBIES = "lobbies";
    private static final String JOIN = "join";
    private static final String STATS = "stats";

    private final SharedState state;
    private final LobbyDomain lobbies;
    private final ServerStats stats;
    private final ServerConfig config;
    private final IntSupplier udpPort;
    private final LongSupplier clock;

    /**
     * Creates the handler.
     *
     * @param state   shared state
     * @param lobbies lobby rules
     * @param stats   statistics served at {@code /stats}
     * @param config  server configuration, for defaults and the public address
     * @param udpPort supplies the bound UDP port reported to clients
     * @param clock   millisecond clock
     */
    public LobbyHttpHandler(SharedState state,
                            LobbyDomain lobbies,
                            ServerStats stats,
                            ServerConfig config,
                            IntSupplier udpPort,
                            LongSupplier clock)
    {
        this.state = Objects.requireNonNull(state, "state");
        this.lobbies = Objects.requireNonNull(lobbies, "lobbies");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.config = Objects.requireNonNull(config, "config");
        this.udpPort = Objects.requireNonNull(udpPort, "udpPort");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException
    {
        try
        {
            addCorsHeaders(exchange.getResponseHeaders());
            String method = exchange.getRequestMethod();
            if ("OPTIONS".equals(method))
            {
                exchange.sendResponseHeaders(204, -1);
                return;
            }

            try
            {
                route(exchange, method, segments(exchange.getRequestURI().getPath()));
            }
            catch (NotFoundException e)
            {
                sendError(exchange, 404, e.getMessage());
            }
            catch (ConflictException | LobbyFullException e)
            {
                sendError(exchange, 409, e.getMessage());
            }
            catch (ServerFullException e)
            {
                sendError(exchange, 503, e.getMessage());
            }
            catch (MalformedMessageException | IllegalArgumentException e)
            {
                sendError(exchange, 400, e.getMessage());
            }
            catch (MethodNotAllowedException e)
            {
                sendError(exchange, 405, e.getMessage());
            }
            catch (RuntimeException e)
            {
                LOG.error("Error handling {} {}", method, exchange.getRequestURI(), e);
                sendError(exchange, 500, "Internal server error");
            }
        }
        finally
        {
            exchange.close();
        }
    }

    private void route(HttpExchange exchange, String method, List<String> path)
            throws IOException, MalformedMessageException
    {
        if (path.size() == 1 && STATS.equals(path.get(0)))
        {
            requireMethod(method, "GET");
            sendJson(exchange, 200, stats.snapshot());
        }
        else if (path.size() == 1 && LOBBIES.equals(path.get(0)))
        {
            if ("GET".equals(method))
            {
                sendJson(exchange, 200, listLobbies());
            }
            else
            {
                requireMethod(method, "POST");
                sendJson(exchange, 200, createLobby(readBody(exchange, CreateLobbyRequest.class)));
            }
        }
        else if (path.size() == 2 && LOBBIES.equals(path.get(0)))
        {
            requireMethod(method, "GET");
            sendJson(exchange, 200, getLobby(path.get(1)));
        }
        else if (path.size() == 3 && LOBBIES.equals(path.get(0)) && JOIN.equals(path.get(2)))
        {
            requireMethod(method, "POST");
            sendJson(exchange, 200, joinLobby(path.get(1), readBody(exchange, JoinLobbyRequest.class)));
        }
        else
        {
            throw new NotFoundException("No route for " + exchange.getRequestURI().getPath());
        }
    }

    // ========== Operations ==========

    private LobbyInfo createLobby(CreateLobbyRequest request)
    {
        if (request.code() == null || request.code().isBlank())
        {
            throw new IllegalArgumentException("code must not be empty");
        }
        int maxPlayers = request.maxPlayers() != null ? request.maxPlayers() : config.getDefaultMaxPlayers();
        if (maxPlayers <= 0)
        {
            throw new IllegalArgumentException("max_players must be positive");
        }
        String scene = request.scene() != null && !request.scene().isBlank()
                ? request.scene()
                : config.getDefaultScene();

        long now = clock.getAsLong();
        LobbySnapshot created = state.write(s -> lobbies.createLobby(s, request.code(), maxPlayers, scene, now));
        return toInfo(created);
    }

    private JoinLobbyResponse joinLobby(String code, JoinLobbyRequest request)
    {
        if (request.playerName() == null || request.playerName().isBlank())
        {
            throw new IllegalArgumentException("player_name must not be empty");
        }
        long now = clock.getAsLong();
        JoinResult result = state.write(s -> lobbies.joinLobby(s, code, request.playerName(), now));
        return new JoinLobbyResponse(toInfo(result.lobby()), result.playerId());
    }

    private LobbyInfo getLobby(String code)
    {
        return state.read(s -> lobbies.getLobby(s, code))
                .map(this::toInfo)
                .orElseThrow(() -> NotFoundException.lobby(code));
    }

    private List<LobbyInfo> listLobbies()
    {
        return state.read(lobbies::listLobbies).stream()
                .map(this::toInfo)
                .toList();
    }

    private LobbyInfo toInfo(LobbySnapshot lobby)
    {
        return new LobbyInfo(
                lobby.code(),
                lobby.playerCount(),
                lobby.maxPlayers(),
                lobby.players(),
                config.getPublicAddress(),
                udpPort.getAsInt(),
                lobby.scene()
        );
    }

    // ========== Plumbing ==========

    private static List<String> segments(String path)
    {
        return Arrays.stream(path.split("/"))
                .filter(segment -> !segment.isEmpty())
                .toList();
    }

    private static void requireMethod(String actual, String expected)
    {
        if (!expected.equals(actual))
        {
            throw new MethodNotAllowedException("Method not allowed: " + actual);
        }
    }

    private static <T> T readBody(HttpExchange exchange, Class<T> type) throws IOException, MalformedMessageException
    {
        byte[] body;
        try (InputStream in = exchange.getRequestBody())
        {
            body = in.readAllBytes();
        }
        return MessageCodec.fromJson(body, type);
    }

    private static void addCorsHeaders(Headers headers)
    {
        headers.set("Access-Control-Allow-Origin", "*");
        headers.set("Access-Control-Allow-Methods", "GET, POST, OPTIONS");
        headers.set("Access-Control-Allow-Headers", "Content-Type");
    }

    private static void sendError(HttpExchange exchange, int status, String message) throws IOException
    {
        sendJson(exchange, status, new ErrorResponse(message));
    }

    private static void sendJson(HttpExchange exchange, int status, Object body) throws IOException
    {
        byte[] bytes = MessageCodec.toJson(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody())
        {
            out.write(bytes);
        }
    }

    private static class MethodNotAllowedException extends RuntimeException
    {
        MethodNotAllowedException(String message)
        {
            super(message);
        }
    }
}
