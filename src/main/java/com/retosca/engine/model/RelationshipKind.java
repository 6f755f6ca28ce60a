package com.retosca.engine.model;

/**
 * Relationship types emitted on requirements.
 */
public enum RelationshipKind {

    DEPENDS_ON("DependsOn"),
    CONNECTS_TO("ConnectsTo"),
    HOSTED_ON("HostedOn"),
    LINKS_TO("LinksTo"),
    ATTACHES_TO("AttachesTo"),
    ROUTES_TO("RoutesTo");

    private final String toscaName;

    RelationshipKind(String toscaName) {
        this.toscaName = toscaName;
    }

    public String getToscaName() {
        return toscaName;
    }
}
