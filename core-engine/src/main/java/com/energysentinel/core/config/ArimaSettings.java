package com.energysentinel.core.config;

import java.util.List;

/**
 * Order search space of the autoregressive forecaster.
 */
public class ArimaSettings {

    private int maxP = 3;
    private int maxD = 2;
    private int maxQ = 3;

    void collectErrors(List<String> errors) {
        if (maxP < 0 || maxP > 5) {
            errors.add("forecast.autoregressive.maxP must be in [0, 5]");
        }
        if (maxD < 0 || maxD > 2) {
            errors.add("forecast.autoregressive.maxD must be in [0, 2]");
        }
        if (maxQ < 0 || maxQ > 5) {
            errors.add("forecast.autoregressive.maxQ must be in [0, 5]");
        }
    }

    public int getMaxP() {
        return maxP;
    }

    public void setMaxP(int maxP) {
        this.maxP = maxP;
    }

    public int getMaxD() {
        return maxD;
    }

    public void setMaxD(int maxD) {
        this.maxD = maxD;
    }

    public int getMaxQ() {
        return maxQ;
    }

    public void setMaxQ(int maxQ) {
        this.maxQ = maxQ;
    }
}
