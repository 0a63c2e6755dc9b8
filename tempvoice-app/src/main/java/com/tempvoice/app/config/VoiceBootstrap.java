package com.tempvoice.app.config;

import com.tempvoice.common.config.ConfigService;
import com.tempvoice.common.config.TempVoiceConfig;
import com.tempvoice.common.infra.SweepRunner;
import com.tempvoice.discord.DiscordGatewayClient;
import com.tempvoice.voice.VoiceSubsystem;
import com.tempvoice.voice.reconcile.ReconcileReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Connects to the gateway once the context is ready and runs the periodic
 * maintenance: reconciliation and bypass expiry. Stops both on shutdown.
 */
@Slf4j
@Component
public class VoiceBootstrap implements DisposableBean {

    private final VoiceSubsystem voice;
    private final DiscordGatewayClient gateway;
    private final SweepRunner reconcileRunner;
    private final SweepRunner bypassRunner;

    public VoiceBootstrap(ConfigService configService, VoiceSubsystem voice, DiscordGatewayClient gateway) {
        this.voice = voice;
        this.gateway = gateway;
        TempVoiceConfig.VoiceConfig config = configService.loadConfig().getVoice();
        this.reconcileRunner = new SweepRunner("voice-reconcile", config.getReconcileIntervalMs(),
                reason -> reconcile());
        this.bypassRunner = new SweepRunner("bypass-sweep", config.getBypassSweepIntervalMs(),
                reason -> voice.getBypass().sweep());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        gateway.start();
        reconcileRunner.start();
        bypassRunner.start();
        log.info("TempVoice ready");
    }

    /** Skipped while disconnected, when the member cache may be stale. */
    ReconcileReport reconcile() {
        if (!gateway.isConnected()) {
            log.debug("Gateway not connected, skipping reconciliation");
            return ReconcileReport.EMPTY;
        }
        ReconcileReport report = voice.getReconciliation().reconcileAll();
        if (report.failures() > 0) {
            log.warn("Reconciliation finished with {} failures", report.failures());
        }
        return report;
    }

    public SweepRunner getReconcileRunner() {
        return reconcileRunner;
    }

    public SweepRunner getBypassRunner() {
        return bypassRunner;
    }

    @Override
    public void destroy() {
        reconcileRunner.close();
        bypassRunner.close();
    }
}
