package com.aurumshield.backend.service;

import com.aurumshield.backend.capital.CapitalBase;
import com.aurumshield.backend.capital.CapitalSnapshot;
import com.aurumshield.backend.dto.TransactionPolicyRequest;
import com.aurumshield.backend.policy.PolicySnapshot;
import com.aurumshield.backend.policy.RiskConfiguration;
import com.aurumshield.backend.policy.TransactionRiskScorer;
import com.aurumshield.backend.service.capital.CapitalControlService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Scores a proposed transaction against the active risk configuration and the platform's current
 * gross exposure.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TransactionPolicyService {

    private final TransactionRiskScorer scorer;
    private final RiskConfigurationService riskConfigurationService;
    private final ExposureStateProvider exposureStateProvider;
    private final CapitalControlService capitalControlService;

    public PolicySnapshot evaluate(TransactionPolicyRequest request, Instant now) {
        RiskConfiguration config = riskConfigurationService.getActiveConfig(now);
        CapitalBase capital = currentCapital(now);

        PolicySnapshot snapshot = scorer.evaluate(request.getCounterparty(), request.getCorridor(), request.getHub(),
                request.getAmount(), capital, config, now);

        if (snapshot.blocked()) {
            log.warn("Transaction policy BLOCKED: cp={} corridor={} hub={} amount={} tri={} blockers={}",
                    snapshot.counterpartyId(), snapshot.corridorId(), snapshot.hubId(), snapshot.amount(),
                    snapshot.tri().score(), snapshot.blockers().size());
        } else {
            log.info("Transaction policy evaluated: cp={} amount={} tri={} ({}) approval={}",
                    snapshot.counterpartyId(), snapshot.amount(), snapshot.tri().score(), snapshot.tri().band(),
                    snapshot.approval().tier());
        }
        return snapshot;
    }

    private CapitalBase currentCapital(Instant now) {
        CapitalBase base = exposureStateProvider.currentState(now).capital();
        CapitalSnapshot snapshot = capitalControlService.canonicalSnapshot(now);
        return new CapitalBase(base.capitalBase(), base.hardstopLimit(), base.tvar99(),
                snapshot.grossExposureNotional());
    }
}
