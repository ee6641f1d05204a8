package com.swisscoin.ledger.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.swisscoin.ledger.core.store.LedgerDataAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

@Service
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    private final ObjectMapper mapper = new ObjectMapper();
    private final Path cfgPath;

    public ConfigService(@Value("${app.data.dir}") String dataDir) {
        this.cfgPath = Paths.get(dataDir).resolve("config.json");
    }

    /**
     * Saves the viewer profile to {@code config.json} in the data directory.
     */
    public void saveSession(ViewerSession session) {
        Map<String, Object> last = new HashMap<>();
        last.put("viewerId", session.viewerId);
        last.put("displayName", session.displayName);
        last.put("defaultCurrency", session.defaultCurrency);

        Map<String, Object> root = new HashMap<>();
        root.put("lastSession", last);
        try {
            Files.createDirectories(cfgPath.getParent());
            Files.writeString(cfgPath, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root));
        } catch (IOException e) {
            throw new LedgerDataAccessException("cannot write " + cfgPath, e);
        }
    }

    /**
     * Restores the saved profile into {@code session}; true when a viewer id was found.
     * A missing default currency keeps the configured one.
     */
    @SuppressWarnings("unchecked")
    public boolean tryRestore(ViewerSession session) {
        if (!Files.exists(cfgPath)) return false;
        try {
            Map<String, Object> root = mapper.readValue(Files.readAllBytes(cfgPath), Map.class);
            Object ls = root.get("lastSession");
            if (!(ls instanceof Map)) return false;
            Map<String, Object> last = (Map<String, Object>) ls;

            session.viewerId = (String) last.get("viewerId");
            session.displayName = (String) last.get("displayName");
            String currency = (String) last.get("defaultCurrency");
            if (currency != null && !currency.isBlank()) session.defaultCurrency = currency;

            if (!session.isSignedIn()) {
                log.warn("[config] restore incomplete: name={}, viewerId missing", session.displayName);
                return false;
            }
            return true;
        } catch (IOException | ClassCastException e) {
            log.warn("[config] restore failed: {}", e.getMessage());
            return false;
        }
    }

    public void clear() {
        try {
            Files.deleteIfExists(cfgPath);
        } catch (IOException e) {
            throw new LedgerDataAccessException("cannot delete " + cfgPath, e);
        }
    }
}
