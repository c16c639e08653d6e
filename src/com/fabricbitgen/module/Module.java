/*
 *
 * Copyright (c) 2024, FabricBitGen contributors.
 * All rights reserved.
 *
 * This file is part of FabricBitGen.
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
 */
package com.fabricbitgen.module;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A module of the physical fabric.  Can be both a leaf module (a
 * configuration memory) or a hierarchical module instantiating other
 * modules.
 */
public class Module {

    private final int id;

    private final String name;

    private Map<String, ModulePort> ports;

    /** Number of instances of each child module inside this module */
    private Map<Module, Integer> childInstanceCounts;

    /** Explicit instance names, keyed by child module then instance index */
    private Map<Module, Map<Integer, String>> instanceNames;

    private List<ConfigurableChild> configurableChildren;

    protected Module(int id, String name) {
        this.id = id;
        this.name = name;
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    protected ModulePort addPort(ModulePort port) {
        if (ports == null) ports = new LinkedHashMap<>();
        if (ports.containsKey(port.getName())) {
            throw new RuntimeException("ERROR: Module " + name + " already has a port named " + port.getName());
        }
        ports.put(port.getName(), port);
        return port;
    }

    /**
     * Gets the named port on this module.
     * @param portName Name of the port.
     * @return The port, or null if none found by that name.
     */
    public ModulePort getPort(String portName) {
        return ports == null ? null : ports.get(portName);
    }

    public Collection<ModulePort> getPorts() {
        return ports == null ? Collections.emptyList() : Collections.unmodifiableCollection(ports.values());
    }

    protected int addChildInstance(Module child) {
        if (childInstanceCounts == null) childInstanceCounts = new HashMap<>();
        int index = childInstanceCounts.getOrDefault(child, 0);
        childInstanceCounts.put(child, index + 1);
        return index;
    }

    /**
     * @param child A child module type.
     * @return Number of instances of child inside this module.
     */
    public int getNumChildInstances(Module child) {
        return childInstanceCounts == null ? 0 : childInstanceCounts.getOrDefault(child, 0);
    }

    protected void setInstanceName(Module child, int instanceIndex, String instanceName) {
        if (instanceNames == null) instanceNames = new HashMap<>();
        instanceNames.computeIfAbsent(child, k -> new HashMap<>()).put(instanceIndex, instanceName);
    }

    protected String getExplicitInstanceName(Module child, int instanceIndex) {
        if (instanceNames == null) return null;
        Map<Integer, String> names = instanceNames.get(child);
        return names == null ? null : names.get(instanceIndex);
    }

    protected void addConfigurableChild(ConfigurableChild child) {
        if (configurableChildren == null) configurableChildren = new ArrayList<>();
        configurableChildren.add(child);
    }

    /**
     * Gets the configurable children in the order configuration bits are
     * loaded through this module.
     * @return The configurable children, empty for a leaf module.
     */
    public List<ConfigurableChild> getConfigurableChildren() {
        return configurableChildren == null ? Collections.emptyList()
                : Collections.unmodifiableList(configurableChildren);
    }

    @Override
    public String toString() {
        return name;
    }
}
