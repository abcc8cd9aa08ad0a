package com.transmissionweb.feeder.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.transmissionweb.feeder.client.rpc.FreeSpace;
import com.transmissionweb.feeder.client.rpc.FreeSpaceArguments;
import com.transmissionweb.feeder.client.rpc.Peer;
import com.transmissionweb.feeder.client.rpc.PortTestResult;
import com.transmissionweb.feeder.client.rpc.RpcRequest;
import com.transmissionweb.feeder.client.rpc.SessionStats;
import com.transmissionweb.feeder.client.rpc.Torrent;
import com.transmissionweb.feeder.client.rpc.TorrentAddArguments;
import com.transmissionweb.feeder.client.rpc.TorrentAddResult;
import com.transmissionweb.feeder.client.rpc.TorrentGetArguments;
import com.transmissionweb.feeder.client.rpc.TorrentIdsArguments;
import com.transmissionweb.feeder.client.rpc.TorrentList;
import com.transmissionweb.feeder.client.rpc.TorrentPeers;
import com.transmissionweb.feeder.client.rpc.TorrentRemoveArguments;
import com.transmissionweb.feeder.config.TransmissionProperties;
import com.transmissionweb.feeder.exception.RpcProtocolException;
import com.transmissionweb.feeder.exception.RpcSessionException;
import com.transmissionweb.feeder.exception.RpcTransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Client for the Transmission daemon's JSON-RPC endpoint.
 *
 * <p>Every call is a POST of {@code {"method", "arguments"}}. The daemon guards the endpoint
 * with a session token: a request carrying a stale or missing token is answered with 409 and
 * the current token in {@value #SESSION_HEADER}. The client stores that token and replays the
 * request once. The token is shared by all callers of this bean.
 */
@Component
@Slf4j
public class TransmissionRpcClient {

    public static final String SESSION_HEADER = "X-Transmission-Session-Id";

    static final List<String> TORRENT_FIELDS = List.of(
            "id", "name", "status", "percentDone", "rateDownload", "rateUpload",
            "uploadRatio", "totalSize", "downloadedEver", "uploadedEver",
            "peersConnected", "eta", "error", "errorString", "addedDate"
    );

    private static final List<String> PEER_FIELDS = List.of("id", "peers");

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final TransmissionProperties properties;

    private final ReentrantReadWriteLock sessionLock = new ReentrantReadWriteLock();
    private String sessionId;

    public TransmissionRpcClient(@Qualifier("transmissionRestTemplate") RestTemplate restTemplate,
                                 ObjectMapper objectMapper,
                                 TransmissionProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Sends one RPC call and decodes its {@code arguments} object into {@code resultType}.
     * Pass {@code Void.class} for methods whose reply carries nothing of interest.
     *
     * @throws RpcTransportException daemon unreachable or non-2xx status
     * @throws RpcSessionException   409 persisted after one token refresh
     * @throws RpcProtocolException  result other than "success", or an unreadable reply
     */
    public <T> T execute(String method, Object arguments, Class<T> resultType) {
        String body = serialize(method, arguments);

        ResponseEntity<String> response;
        try {
            response = send(method, body, currentSessionId());
        } catch (HttpClientErrorException.Conflict conflict) {
            String freshId = conflict.getResponseHeaders() != null
                    ? conflict.getResponseHeaders().getFirst(SESSION_HEADER)
                    : null;
            if (freshId == null || freshId.isBlank()) {
                throw RpcSessionException.missingToken(method);
            }
            updateSessionId(freshId);
            log.debug("Transmission session refreshed while calling {}", method);

            try {
                response = send(method, body, freshId);
            } catch (HttpClientErrorException.Conflict again) {
                log.warn("Transmission rejected refreshed session for {}", method);
                throw RpcSessionException.rejectedAfterRefresh(method);
            }
        }

        return decode(method, response.getBody(), resultType);
    }

    public List<Torrent> getTorrents() {
        TorrentList list = execute("torrent-get", TorrentGetArguments.allTorrents(TORRENT_FIELDS), TorrentList.class);
        return list.torrents();
    }

    public SessionStats getSessionStats() {
        return execute("session-stats", null, SessionStats.class);
    }

    public PortTestResult testPort() {
        return execute("port-test", null, PortTestResult.class);
    }

    public FreeSpace getFreeSpace(String path) {
        return execute("free-space", new FreeSpaceArguments(path), FreeSpace.class);
    }

    public TorrentAddResult addTorrent(TorrentAddArguments arguments) {
        TorrentAddResult result = execute("torrent-add", arguments, TorrentAddResult.class);
        if (result.torrent() != null) {
            log.info("Torrent {}: {}", result.isDuplicate() ? "already present" : "added", result.torrent().name());
        }
        return result;
    }

    public TorrentAddResult addTorrentByUrl(String magnetOrUrl) {
        return addTorrent(TorrentAddArguments.ofUrl(magnetOrUrl));
    }

    public TorrentAddResult addTorrentByMetainfo(byte[] torrentData) {
        return addTorrent(TorrentAddArguments.ofMetainfo(torrentData));
    }

    public void startTorrent(int id) {
        execute("torrent-start", TorrentIdsArguments.of(id), Void.class);
    }

    public void stopTorrent(int id) {
        execute("torrent-stop", TorrentIdsArguments.of(id), Void.class);
    }

    public void removeTorrent(int id, boolean deleteLocalData) {
        execute("torrent-remove", TorrentRemoveArguments.of(id, deleteLocalData), Void.class);
    }

    public void reannounceTorrent(int id) {
        execute("torrent-reannounce", TorrentIdsArguments.of(id), Void.class);
    }

    /**
     * Reannounces every torrent. The request carries no arguments at all.
     */
    public void reannounceAll() {
        execute("torrent-reannounce", null, Void.class);
    }

    /**
     * Peers of one torrent, or an empty list when the daemon does not know the id.
     */
    public List<Peer> getPeers(int id) {
        TorrentPeers peers = execute("torrent-get", TorrentGetArguments.forTorrent(id, PEER_FIELDS), TorrentPeers.class);
        return peers.firstPeers();
    }

    private ResponseEntity<String> send(String method, String body, String session) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (properties.hasCredentials()) {
            String password = properties.getPassword() != null ? properties.getPassword() : "";
            headers.setBasicAuth(properties.getUsername(), password, StandardCharsets.UTF_8);
        }
        if (session != null) {
            headers.set(SESSION_HEADER, session);
        }

        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(
                    properties.getUrl(), HttpMethod.POST, new HttpEntity<>(body, headers), String.class);
        } catch (HttpClientErrorException.Conflict conflict) {
            throw conflict;
        } catch (HttpStatusCodeException e) {
            log.warn("Transmission RPC {} failed with HTTP {}", method, e.getStatusCode().value());
            throw RpcTransportException.httpError(method, e.getStatusCode().value());
        } catch (ResourceAccessException e) {
            log.warn("Transmission unreachable at {}: {}", properties.getUrl(), e.getMessage());
            throw RpcTransportException.unreachable(method, e);
        } catch (RestClientException e) {
            throw RpcTransportException.unreachable(method, e);
        }

        if (!response.getStatusCode().is2xxSuccessful()) {
            throw RpcTransportException.httpError(method, response.getStatusCode().value());
        }
        return response;
    }

    private String serialize(String method, Object arguments) {
        try {
            return objectMapper.writeValueAsString(new RpcRequest(method, arguments));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode arguments of " + method, e);
        }
    }

    private <T> T decode(String method, String body, Class<T> resultType) {
        if (body == null || body.isBlank()) {
            throw RpcProtocolException.undecodable(method, new IllegalStateException("empty body"));
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode result = root.get("result");
            if (result == null || !"success".equals(result.asText())) {
                String reported = result != null ? result.asText() : "no result field";
                log.warn("Transmission RPC {} rejected: {}", method, reported);
                throw RpcProtocolException.rejected(method, reported);
            }
            if (resultType == Void.class) {
                return null;
            }
            JsonNode arguments = root.get("arguments");
            if (arguments == null || arguments.isNull()) {
                arguments = objectMapper.createObjectNode();
            }
            return objectMapper.treeToValue(arguments, resultType);
        } catch (JsonProcessingException e) {
            throw RpcProtocolException.undecodable(method, e);
        }
    }

    private String currentSessionId() {
        sessionLock.readLock().lock();
        try {
            return sessionId;
        } finally {
            sessionLock.readLock().unlock();
        }
    }

    private void updateSessionId(String freshId) {
        sessionLock.writeLock().lock();
        try {
            sessionId = freshId;
        } finally {
            sessionLock.writeLock().unlock();
        }
    }
}
