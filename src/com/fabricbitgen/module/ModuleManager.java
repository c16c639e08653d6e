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
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.NotNull;

/**
 * Holds every module of the physical fabric along with the instances each
 * module creates and the order in which its configurable children are
 * chained.
 */
public class ModuleManager {

    private final List<Module> modules = new ArrayList<>();

    private final Map<String, Module> moduleMap = new HashMap<>();

    /**
     * Creates a new module.  Checks for a name collision.
     * @param name Name of the module.
     * @return The newly created module.
     */
    public Module createModule(String name) {
        if (moduleMap.containsKey(name)) {
            throw new RuntimeException("ERROR: Module named " + name + " already exists");
        }
        Module module = new Module(modules.size(), name);
        modules.add(module);
        moduleMap.put(name, module);
        return module;
    }

    /**
     * Gets the module by name.
     * @param name Name of the module.
     * @return The module, or null if none found by that name.
     */
    public Module findModule(String name) {
        return moduleMap.get(name);
    }

    public List<Module> getModules() {
        return Collections.unmodifiableList(modules);
    }

    /**
     * Creates a port on the provided module.
     * @param module The module to add the port to.
     * @param name Name of the port.
     * @param width Width of the port in bits.
     * @return The newly created port.
     */
    public ModulePort createPort(Module module, String name, int width) {
        return module.addPort(new ModulePort(module, name, width));
    }

    /**
     * Gets the named port of a module.
     * @param module The module to search.
     * @param name Name of the port.
     * @return The port, or null if none found by that name.
     */
    public ModulePort findPort(Module module, String name) {
        return module.getPort(name);
    }

    /**
     * Instantiates child inside parent.
     * @param parent The instantiating module.
     * @param child The instantiated module.
     * @return The instance index of the new instance, counted per child module.
     */
    public int addChildModule(Module parent, Module child) {
        if (parent == child) {
            throw new RuntimeException("ERROR: Module " + parent.getName() + " cannot instantiate itself");
        }
        return parent.addChildInstance(child);
    }

    /**
     * Gives an explicit name to an existing child instance.
     */
    public void setInstanceName(Module parent, Module child, int instanceIndex, String instanceName) {
        checkInstance(parent, child, instanceIndex);
        parent.setInstanceName(child, instanceIndex, instanceName);
    }

    /**
     * Gets the name of a child instance.  Instances without an explicit name
     * are named after their module and index, e.g. "grid_clb_3_".
     * @param parent The instantiating module.
     * @param child The instantiated module.
     * @param instanceIndex Index of the instance.
     * @return The instance name.
     */
    @NotNull
    public String getInstanceName(Module parent, Module child, int instanceIndex) {
        String name = parent.getExplicitInstanceName(child, instanceIndex);
        if (name == null || name.isEmpty()) {
            return generateInstanceName(child.getName(), instanceIndex);
        }
        return name;
    }

    public static String generateInstanceName(String moduleName, int instanceIndex) {
        return moduleName + "_" + instanceIndex + "_";
    }

    /**
     * Appends an existing child instance to the configurable children of parent.
     * The order of calls decides the order bits are loaded in.
     */
    public void addConfigurableChild(Module parent, Module child, int instanceIndex) {
        checkInstance(parent, child, instanceIndex);
        parent.addConfigurableChild(new ConfigurableChild(child, instanceIndex));
    }

    public List<ConfigurableChild> getConfigurableChildren(Module module) {
        return module.getConfigurableChildren();
    }

    private void checkInstance(Module parent, Module child, int instanceIndex) {
        if (instanceIndex < 0 || instanceIndex >= parent.getNumChildInstances(child)) {
            throw new RuntimeException("ERROR: Module " + parent.getName() + " has no instance "
                    + instanceIndex + " of module " + child.getName());
        }
    }
}
