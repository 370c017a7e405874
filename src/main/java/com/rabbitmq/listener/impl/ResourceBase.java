// Copyright (c) 2025 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.rabbitmq.listener.impl;

import com.rabbitmq.listener.Resource;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Lifecycle state of a consumer, with synchronous notification of its state listeners. */
abstract class ResourceBase implements Resource {

  private static final Logger LOGGER = LoggerFactory.getLogger(ResourceBase.class);

  private final AtomicReference<State> state = new AtomicReference<>(State.CREATED);
  private final List<StateListener> listeners;

  ResourceBase(List<StateListener> listeners) {
    this.listeners = List.copyOf(listeners);
  }

  @Override
  public State state() {
    return this.state.get();
  }

  /**
   * Move to the new state only if the current state is the expected one.
   *
   * @return true if the transition happened
   */
  protected boolean compareAndSetState(State expected, State newState) {
    if (this.state.compareAndSet(expected, newState)) {
      this.notifyListeners(expected, newState, null);
      return true;
    }
    return false;
  }

  protected void state(State state) {
    this.state(state, null);
  }

  protected void state(State state, Throwable failureCause) {
    State previousState = this.state.getAndSet(state);
    if (state != previousState) {
      this.notifyListeners(previousState, state, failureCause);
    }
  }

  private void notifyListeners(State previous, State current, Throwable failureCause) {
    if (this.listeners.isEmpty()) {
      return;
    }
    StateChange change = new StateChange(previous, current, failureCause);
    for (StateListener listener : this.listeners) {
      try {
        listener.handle(change);
      } catch (Exception e) {
        // a listener must not break the start or stop sequence
        LOGGER.warn("Error in state listener on {} -> {} for {}", previous, current, this, e);
      }
    }
  }

  private final class StateChange implements Context {

    private final State previousState;
    private final State currentState;
    private final Throwable failureCause;

    private StateChange(State previousState, State currentState, Throwable failureCause) {
      this.previousState = previousState;
      this.currentState = currentState;
      this.failureCause = failureCause;
    }

    @Override
    public Resource resource() {
      return ResourceBase.this;
    }

    @Override
    public Throwable failureCause() {
      return this.failureCause;
    }

    @Override
    public State previousState() {
      return this.previousState;
    }

    @Override
    public State currentState() {
      return this.currentState;
    }

    @Override
    public String toString() {
      return this.previousState + " -> " + this.currentState + " for " + ResourceBase.this;
    }
  }
}
