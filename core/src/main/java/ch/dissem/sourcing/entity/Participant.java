/*
 * Copyright 2017 Christian Basler
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ch.dissem.sourcing.entity;

import java.io.Serializable;
import java.util.Objects;

/**
 * A registered node of the network. Whether it is a miner or a validator is derived from its stake and trust.
 */
public class Participant implements Serializable {
    private static final long serialVersionUID = 6624816337740917725L;

    /**
     * Minimum stake a node needs to act as a validator
     */
    public static final double MIN_VALIDATOR_STAKE = 512;

    private final int uid;
    private final String hotkey;
    private final double stake;
    private final boolean validatorPermit;
    private final double validatorTrust;

    private Participant(Builder builder) {
        uid = builder.uid;
        hotkey = builder.hotkey;
        stake = builder.stake;
        validatorPermit = builder.validatorPermit;
        validatorTrust = builder.validatorTrust;
    }

    public int getUid() {
        return uid;
    }

    public String getHotkey() {
        return hotkey;
    }

    public double getStake() {
        return stake;
    }

    public boolean hasValidatorPermit() {
        return validatorPermit;
    }

    public double getValidatorTrust() {
        return validatorTrust;
    }

    public boolean isMiner() {
        return validatorTrust == 0;
    }

    public boolean isValidator() {
        return validatorPermit && stake >= MIN_VALIDATOR_STAKE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Participant)) return false;
        Participant that = (Participant) o;
        return uid == that.uid && hotkey.equals(that.hotkey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uid, hotkey);
    }

    @Override
    public String toString() {
        return "Participant{" + uid + ", " + hotkey + "}";
    }

    public static final class Builder {
        private int uid = -1;
        private String hotkey;
        private double stake;
        private boolean validatorPermit;
        private double validatorTrust;

        public Builder uid(int uid) {
            this.uid = uid;
            return this;
        }

        public Builder hotkey(String hotkey) {
            this.hotkey = hotkey;
            return this;
        }

        public Builder stake(double stake) {
            this.stake = stake;
            return this;
        }

        public Builder validatorPermit(boolean validatorPermit) {
            this.validatorPermit = validatorPermit;
            return this;
        }

        public Builder validatorTrust(double validatorTrust) {
            this.validatorTrust = validatorTrust;
            return this;
        }

        public Participant build() {
            if (uid < 0) {
                throw new IllegalStateException("uid must be set");
            }
            if (hotkey == null) {
                throw new IllegalStateException("hotkey must be set");
            }
            return new Participant(this);
        }
    }
}
