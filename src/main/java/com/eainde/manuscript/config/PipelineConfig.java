package com.eainde.manuscript.config;

import com.eainde.manuscript.checkpoint.CheckpointCodec;
import com.eainde.manuscript.collaborator.ClaimStore;
import com.eainde.manuscript.collaborator.TextRewriter;
import com.eainde.manuscript.edges.CriticRoutingEdge;
import com.eainde.manuscript.governance.conflict.ConflictDetector;
import com.eainde.manuscript.governance.conflict.ConflictSettings;
import com.eainde.manuscript.governance.gate.CitationGate;
import com.eainde.manuscript.governance.gate.ConflictGate;
import com.eainde.manuscript.governance.gate.GovernanceGates;
import com.eainde.manuscript.governance.gate.PrecisionGate;
import com.eainde.manuscript.governance.gate.ToneGate;
import com.eainde.manuscript.governance.precision.PrecisionGovernor;
import com.eainde.manuscript.governance.precision.PrecisionSettings;
import com.eainde.manuscript.governance.tone.ToneGovernor;
import com.eainde.manuscript.governance.tone.ToneLinter;
import com.eainde.manuscript.governance.tone.TonePolicy;
import com.eainde.manuscript.governance.tone.TonePolicyLoader;
import com.eainde.manuscript.model.ConsistencyRule;
import com.eainde.manuscript.model.RoundingRule;
import com.eainde.manuscript.state.RigorLevel;
import com.eainde.manuscript.workflow.PipelineSettings;
import com.eainde.manuscript.workflow.StageRouter;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.time.Clock;

/**
 * Wires the routing, the governors and the governance gates from {@code manuscript.*} properties.
 */
@Log4j2
@Configuration
public class PipelineConfig {

    // ── Pipeline ────────────────────────────────────────────────────────

    @Value("${manuscript.pipeline.max-revisions:3}")
    private int maxRevisions;

    @Value("${manuscript.pipeline.reframing-on-deadlock:true}")
    private boolean reframingOnDeadlock;

    @Value("${manuscript.pipeline.default-rigor:conservative}")
    private String defaultRigor;

    // ── Conflicts ───────────────────────────────────────────────────────

    @Value("${manuscript.conflict.human-review-threshold:2}")
    private int humanReviewThreshold;

    @Value("${manuscript.conflict.excerpt-length:60}")
    private int excerptLength;

    // ── Precision ───────────────────────────────────────────────────────

    @Value("${manuscript.precision.max-sig-figs:4}")
    private int maxSigFigs;

    @Value("${manuscript.precision.conservative-max-decimals:2}")
    private int conservativeMaxDecimals;

    @Value("${manuscript.precision.exploratory-max-decimals:3}")
    private int exploratoryMaxDecimals;

    @Value("${manuscript.precision.rounding:half_up}")
    private String rounding;

    @Value("${manuscript.precision.consistency:per_column}")
    private String consistency;

    // ── Tone ────────────────────────────────────────────────────────────

    @Value("${manuscript.tone.policy-location:classpath:neutral-tone.yml}")
    private Resource tonePolicyLocation;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PipelineSettings pipelineSettings() {
        PipelineSettings settings = new PipelineSettings(maxRevisions, reframingOnDeadlock,
                RigorLevel.fromWire(defaultRigor));
        log.info("Pipeline: max {} revision(s), reframing on deadlock {}, default rigor {}",
                settings.maxRevisions(), settings.reframingOnDeadlock(), settings.defaultRigor().wireName());
        return settings;
    }

    @Bean
    public CriticRoutingEdge criticRoutingEdge(PipelineSettings settings) {
        return new CriticRoutingEdge(settings.maxRevisions(), settings.reframingOnDeadlock());
    }

    @Bean
    public StageRouter stageRouter(CriticRoutingEdge criticRoutingEdge) {
        return new StageRouter(criticRoutingEdge);
    }

    @Bean
    public CheckpointCodec checkpointCodec(ObjectMapper objectMapper) {
        return new CheckpointCodec(objectMapper);
    }

    @Bean
    public ConflictSettings conflictSettings() {
        return new ConflictSettings(maxRevisions, humanReviewThreshold, excerptLength);
    }

    @Bean
    public ConflictDetector conflictDetector(ClaimStore claimStore, ConflictSettings conflictSettings) {
        return new ConflictDetector(claimStore, conflictSettings);
    }

    @Bean
    public PrecisionSettings precisionSettings() {
        return new PrecisionSettings(maxSigFigs, conservativeMaxDecimals, exploratoryMaxDecimals,
                RoundingRule.fromWire(rounding), ConsistencyRule.fromWire(consistency));
    }

    @Bean
    public PrecisionGovernor precisionGovernor() {
        return new PrecisionGovernor();
    }

    @Bean
    public TonePolicy tonePolicy() {
        return new TonePolicyLoader().load(tonePolicyLocation);
    }

    @Bean
    public ToneLinter toneLinter(TonePolicy tonePolicy) {
        return new ToneLinter(tonePolicy);
    }

    @Bean
    public ToneGovernor toneGovernor(ToneLinter toneLinter, TextRewriter textRewriter) {
        return new ToneGovernor(toneLinter, textRewriter);
    }

    @Bean
    public GovernanceGates governanceGates(ToneGovernor toneGovernor, PrecisionGovernor precisionGovernor,
                                           PrecisionSettings precisionSettings) {
        return new GovernanceGates(
                new ToneGate(toneGovernor),
                new PrecisionGate(precisionGovernor, precisionSettings),
                new CitationGate(),
                new ConflictGate());
    }
}
