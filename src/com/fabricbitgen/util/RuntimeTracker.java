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
package com.fabricbitgen.util;

/**
 * A customized RuntimeTracker class, providing start and stop methods for recording total elapsed time of a process.
 * Each {@link RuntimeTracker} Object should be created at least with a name.
 */
public class RuntimeTracker {
	private String name;
	private long time;
	private long start;

	public RuntimeTracker(String name) {
		this.name = name + ":";
		this.time = 0;
	}

	public void start() {
		this.start = System.nanoTime();
	}

	/**
	 * Stops the runtime tracker and stores the total time elapsed in nanoseconds.
	 */
	public void stop() {
		this.time += System.nanoTime() - this.start;
	}

	/**
	 * Gets the total time elapsed in nanoseconds.
	 * @return The total time elapsed in nanoseconds.
	 */
	public long getTime() {
		return this.time;
	}

	/**
	 * Gets the runtime tracker name.
	 * @return The runtime tracker name.
	 */
	public String getName() {
		return name;
	}

	@Override
	public int hashCode() {
		return name.hashCode();
	}

	@Override
	public String toString() {
		int length = 36 - this.getName().length();
		if(length < 0) length = 0;
		return this.name + MessageGenerator.makeWhiteSpace(length) + String.format("%9.2fs", this.getTime()*1e-9);
	}
}
