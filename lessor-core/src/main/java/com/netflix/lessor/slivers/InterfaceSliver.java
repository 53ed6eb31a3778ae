/*
 * Copyright 2016 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.netflix.lessor.slivers;

/**
 * A connection point of a network service: a port on a switch or a NIC.
 */
public class InterfaceSliver extends BaseSliver {
    private InterfaceType type;

    public InterfaceSliver(String name, InterfaceType type) {
        super(name);
        this.type = type;
    }

    private InterfaceSliver(InterfaceSliver other) {
        super(other);
        this.type = other.type;
    }

    @Override
    public SliverKind getKind() {
        return SliverKind.Interface;
    }

    @Override
    public InterfaceSliver copy() {
        return new InterfaceSliver(this);
    }

    public InterfaceType getType() {
        return type;
    }

    public void setType(InterfaceType type) {
        this.type = type;
    }
}
