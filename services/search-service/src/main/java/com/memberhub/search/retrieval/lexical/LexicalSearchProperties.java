package com.memberhub.search.retrieval.lexical;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.lexical")
public class LexicalSearchProperties {
    private double k1 = 1.2;
    private double b = 0.75;
    private Weights weights = new Weights();

    public double getK1() {
        return k1;
    }

    public void setK1(double k1) {
        this.k1 = k1;
    }

    public double getB() {
        return b;
    }

    public void setB(double b) {
        this.b = b;
    }

    public Weights getWeights() {
        return weights;
    }

    public void setWeights(Weights weights) {
        this.weights = weights;
    }

    public double weightOf(LexicalField field) {
        return switch (field) {
            case TITLE -> weights.getTitle();
            case DESCRIPTION -> weights.getDescription();
            case BODY -> weights.getBody();
            case TAGS -> weights.getTags();
        };
    }

    public static class Weights {
        private double title = 1.0;
        private double description = 0.4;
        private double body = 0.2;
        private double tags = 0.1;

        public double getTitle() {
            return title;
        }

        public void setTitle(double title) {
            this.title = title;
        }

        public double getDescription() {
            return description;
        }

        public void setDescription(double description) {
            this.description = description;
        }

        public double getBody() {
            return body;
        }

        public void setBody(double body) {
            this.body = body;
        }

        public double getTags() {
            return tags;
        }

        public void setTags(double tags) {
            this.tags = tags;
        }
    }
}
