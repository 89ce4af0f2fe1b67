package org.twinsql.server.api;

import org.twinsql.db.ClientRegistry;
import org.twinsql.db.RegistryInfo;
import org.twinsql.server.config.TwinSqlProperties;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Diagnostics: which clients and pools are live, and how busy each pool is.
 */
@RestController
@RequestMapping("/api/db")
public class DatabaseInfoController {

    private final ClientRegistry registry;
    private final TwinSqlProperties props;

    public DatabaseInfoController(ClientRegistry registry, TwinSqlProperties props) {
        this.registry = Objects.requireNonNull(registry);
        this.props = Objects.requireNonNull(props);
    }

    @GetMapping("/info")
    public Map<String, Object> info() {
        RegistryInfo info = registry.info();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("engine", props.engine().name().toLowerCase(Locale.ROOT));
        out.put("debug", props.debug());
        out.put("instances", info.instances());
        out.put("pools", info.pools());
        out.put("instanceCount", info.instanceCount());
        out.put("poolCount", info.poolCount());
        out.put("poolStats", registry.pools().stats());
        return out;
    }
}
