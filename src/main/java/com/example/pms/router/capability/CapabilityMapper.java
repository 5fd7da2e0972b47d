package com.example.pms.router.capability;

import com.example.pms.router.model.AuthContext;
import com.example.pms.router.model.CandidateAction;
import com.example.pms.router.model.ExtractedEntity;
import com.example.pms.router.model.Lane;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Maps extracted entities to the actions the caller may take. Actions the caller's role or tenant
 * cannot use are left out without a trace.
 */
@Service
@RequiredArgsConstructor
public class CapabilityMapper {

    private final CapabilityRegistry registry;

    public List<CandidateAction> map(List<ExtractedEntity> entities, Lane lane, AuthContext auth) {
        if (lane == Lane.BLOCKED || entities == null || entities.isEmpty() || auth == null || auth.role() == null) {
            return List.of();
        }
        List<CandidateAction> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (ExtractedEntity entity : entities) {
            for (Capability c : registry.forEntityType(entity.type())) {
                if (!c.allowsRole(auth.role()) || !c.enabledFor(auth.tenantId())) {
                    continue;
                }
                if (seen.add(c.actionId())) {
                    out.add(new CandidateAction(c.actionId(), c.label(), c.variant(), c.allowedRoles(),
                            c.requiresSignature(), entity.type(), entity.text()));
                }
            }
        }
        return List.copyOf(out);
    }
}
