package me.golemcore.turnguard.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Per-turn model call counter. Created fresh for every turn attempt and never
 * shared; {@code answerCalls + reflectCalls <= budgetLimit} holds after every
 * successful consumption.
 */
public class TurnCallAccounting {

    private final int budgetLimit;
    private int answerCalls;
    private int reflectCalls;

    public TurnCallAccounting(int budgetLimit) {
        this.budgetLimit = budgetLimit;
    }

    /**
     * Budget of one answer call, plus one reflect call when persona reflection
     * is enabled.
     */
    public static TurnCallAccounting forTurn(boolean reflectEnabled) {
        return new TurnCallAccounting(reflectEnabled ? 2 : 1);
    }

    public void consumeAnswerCall() {
        answerCalls++;
        enforceBudget();
    }

    public void consumeReflectCall() {
        reflectCalls++;
        enforceBudget();
    }

    private void enforceBudget() {
        int consumed = answerCalls + reflectCalls;
        if (consumed > budgetLimit) {
            throw new CallBudgetExceededException(consumed, budgetLimit);
        }
    }

    public int getBudgetLimit() {
        return budgetLimit;
    }

    public int getAnswerCalls() {
        return answerCalls;
    }

    public int getReflectCalls() {
        return reflectCalls;
    }
}
