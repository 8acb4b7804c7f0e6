package com.esign.search.ranking;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.ranking")
public class RankingProperties {
    private double userWeightFactor = 0.3;
    private double clickWeight = 0.3;
    private double collaboratorBonus = 0.2;
    private double recentDocumentBonus = 0.4;
    private double preferredTypeBonus = 0.1;
    private double semanticWeight = 0.2;
    private double semanticMinSimilarity = 0.6;

    public double getUserWeightFactor() {
        return userWeightFactor;
    }

    public void setUserWeightFactor(double userWeightFactor) {
        this.userWeightFactor = userWeightFactor;
    }

    public double getClickWeight() {
        return clickWeight;
    }

    public void setClickWeight(double clickWeight) {
        this.clickWeight = clickWeight;
    }

    public double getCollaboratorBonus() {
        return collaboratorBonus;
    }

    public void setCollaboratorBonus(double collaboratorBonus) {
        this.collaboratorBonus = collaboratorBonus;
    }

    public double getRecentDocumentBonus() {
        return recentDocumentBonus;
    }

    public void setRecentDocumentBonus(double recentDocumentBonus) {
        this.recentDocumentBonus = recentDocumentBonus;
    }

    public double getPreferredTypeBonus() {
        return preferredTypeBonus;
    }

    public void setPreferredTypeBonus(double preferredTypeBonus) {
        this.preferredTypeBonus = preferredTypeBonus;
    }

    public double getSemanticWeight() {
        return semanticWeight;
    }

    public void setSemanticWeight(double semanticWeight) {
        this.semanticWeight = semanticWeight;
    }

    public double getSemanticMinSimilarity() {
        return semanticMinSimilarity;
    }

    public void setSemanticMinSimilarity(double semanticMinSimilarity) {
        this.semanticMinSimilarity = semanticMinSimilarity;
    }
}
