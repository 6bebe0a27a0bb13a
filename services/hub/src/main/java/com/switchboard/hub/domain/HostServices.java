package com.switchboard.hub.domain;

import com.switchboard.hub.domain.host.HostTerminal;
import com.switchboard.protocol.FrameCodec;
import com.switchboard.protocol.ServiceResponse;
import com.switchboard.protocol.TerminalInfo;
import com.switchboard.protocol.TerminalMessage;

/**
 * Services every host terminal provides, plus {@code ListHost} for the admin tenant.
 */
public final class HostServices {

    public static final String LIST_TERMINALS = "ListTerminals";
    public static final String UPDATE_TERMINAL_INFO = "UpdateTerminalInfo";
    public static final String TERMINATE = "Terminate";
    public static final String LIST_HOST = "ListHost";
    public static final String PING = "Ping";

    static final String TERMINATE_DENIED = "You are not allowed to terminate this terminal";

    private HostServices() {
    }

    static void install(HostTerminal host, Tenant tenant, TenantRegistry registry, boolean admin) {
        host.provideChannel(HostTerminal.TERMINAL_INFO_CHANNEL);
        host.provideService(PING, request -> ServiceResponse.ok());
        host.provideService(LIST_TERMINALS, request -> ServiceResponse.ok(tenant.snapshot()));
        host.provideService(UPDATE_TERMINAL_INFO, request -> updateTerminalInfo(tenant, request));
        host.provideService(TERMINATE,
                request -> ServiceResponse.error(ServiceResponse.FORBIDDEN, TERMINATE_DENIED));
        if (admin) {
            host.provideService(LIST_HOST, request -> ServiceResponse.ok(registry.hostRecords()));
        }
    }

    private static ServiceResponse updateTerminalInfo(Tenant tenant, TerminalMessage request) {
        if (request.req() == null || !request.req().isObject()) {
            throw new IllegalArgumentException("terminal info object is required");
        }
        tenant.updateInfo(FrameCodec.fromTree(request.req(), TerminalInfo.class));
        return ServiceResponse.ok();
    }
}
