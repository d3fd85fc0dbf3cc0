package com.comino.cranepose.config;

/****************************************************************************
*
*   Copyright (c) 2026 Eike Mansfeld ecm@gmx.de. All rights reserved.
*
* Redistribution and use in source and binary forms, with or without
* modification, are permitted provided that the following conditions
* are met:
*
* 1. Redistributions of source code must retain the above copyright
*    notice, this list of conditions and the following disclaimer.
* 2. Redistributions in binary form must reproduce the above copyright
*    notice, this list of conditions and the following disclaimer in
*    the documentation and/or other materials provided with the
*    distribution.
* 3. Neither the name of the copyright holder nor the names of its
*    contributors may be used to endorse or promote products derived
*    from this software without specific prior written permission.
*
* THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS
* "AS IS" AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT
* LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS
* FOR A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL THE
* COPYRIGHT OWNER OR CONTRIBUTORS BE LIABLE FOR ANY DIRECT, INDIRECT,
* INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING,
* BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS
* OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED
* AND ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT
* LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN
* ANY WAY OUT OF THE USE OF THIS SOFTWARE, EVEN IF ADVISED OF THE
* POSSIBILITY OF SUCH DAMAGE.
*
****************************************************************************/

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.comino.cranepose.modbus.RegisterMap;

/**
 * Runtime properties of one process.
 * <p>
 * Sources in increasing priority: {@code cranepose.properties} on the
 * classpath, the file given by {@code --config-file=path} and
 * {@code --key=value} arguments. Arguments not of that form are kept as
 * positional arguments.
 */
public class CraneConfig {

	private static final Logger logger = LoggerFactory.getLogger(CraneConfig.class);

	public static final String DEFAULT_RESOURCE = "cranepose.properties";

	public static final float  DEFAULT_FPS              = 8.0f;
	public static final float  MIN_FPS                  = 0.5f;
	public static final int    DEFAULT_RESTART_DELAY_MS = 1000;
	public static final int    MIN_RESTART_DELAY_MS     = 100;
	public static final String DEFAULT_RUNTIME_DIR      = "data/runtime";
	public static final String DEFAULT_CALIBRATION_FILE = "data/calibration_config.json";

	private final Properties          prop;
	private final Map<String,String>  overrides  = new LinkedHashMap<>();
	private final List<String>        positional = new ArrayList<>();

	public CraneConfig() {
		this(new Properties());
	}

	public CraneConfig(Properties prop) {
		this.prop = prop;
	}

	public static CraneConfig fromArgs(String[] args) {
		CraneConfig config = new CraneConfig(loadDefaults());

		Map<String,String> cmd = new LinkedHashMap<>();
		for(String arg : args) {
			if(arg.startsWith("--") && arg.indexOf('=') > 2) {
				int i = arg.indexOf('=');
				cmd.put(arg.substring(2, i), arg.substring(i + 1));
			} else if(arg.startsWith("--")) {
				throw new IllegalArgumentException("Expected --key=value but got "+arg);
			} else {
				config.positional.add(arg);
			}
		}

		String file = cmd.remove(CraneParams.CONFIG_FILE);
		if(file != null)
			config.load(Paths.get(file));

		for(Map.Entry<String,String> e : cmd.entrySet())
			config.setProperty(e.getKey(), e.getValue());
		return config;
	}

	public static Properties loadDefaults() {
		Properties p = new Properties();
		try(InputStream in = CraneConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
			if(in != null)
				p.load(in);
			else
				logger.debug("No {} on classpath", DEFAULT_RESOURCE);
		} catch(IOException e) {
			throw new UncheckedIOException("Loading "+DEFAULT_RESOURCE+" failed", e);
		}
		return p;
	}

	public void load(Path file) {
		try(Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			Properties p = new Properties();
			p.load(r);
			for(String key : p.stringPropertyNames())
				setProperty(key, p.getProperty(key));
			logger.info("Configuration loaded from {}", file);
		} catch(IOException e) {
			throw new UncheckedIOException("Loading configuration "+file+" failed", e);
		}
	}

	public void setProperty(String key, String value) {
		prop.setProperty(key, value);
		overrides.put(key, value);
	}

	public boolean hasProperty(String key) {
		return prop.getProperty(key) != null;
	}

	public String getProperty(String key, String def) {
		String v = prop.getProperty(key, def);
		return v != null ? v.trim() : null;
	}

	public int getIntProperty(String key, String def) {
		String v = getProperty(key, def);
		try {
			return Integer.parseInt(v);
		} catch(NumberFormatException e) {
			throw new IllegalArgumentException("Property "+key+" is not an integer: "+v, e);
		}
	}

	public float getFloatProperty(String key, String def) {
		String v = getProperty(key, def);
		try {
			return Float.parseFloat(v);
		} catch(NumberFormatException e) {
			throw new IllegalArgumentException("Property "+key+" is not a number: "+v, e);
		}
	}

	public boolean getBoolProperty(String key, String def) {
		return Boolean.parseBoolean(getProperty(key, def));
	}

	/**
	 * Values set after the defaults were loaded, as {@code --key=value}
	 * arguments.
	 */
	public List<String> toArgs() {
		List<String> args = new ArrayList<>();
		for(Map.Entry<String,String> e : overrides.entrySet())
			args.add("--"+e.getKey()+"="+e.getValue());
		return args;
	}

	public List<String> getPositional() {
		return positional;
	}

	// Typed accessors

	public float getFps() {
		return Math.max(MIN_FPS, getFloatProperty(CraneParams.POSE_FPS, String.valueOf(DEFAULT_FPS)));
	}

	public RegisterMap getRegisterMap() {
		return new RegisterMap(
				getIntProperty(CraneParams.MODBUS_BRIDGE_BASE, String.valueOf(RegisterMap.DEFAULT_BRIDGE_BASE)),
				getIntProperty(CraneParams.MODBUS_HOOK_BASE,   String.valueOf(RegisterMap.DEFAULT_HOOK_BASE)));
	}

	public int getRestartDelayMs() {
		return Math.max(MIN_RESTART_DELAY_MS, getIntProperty(CraneParams.SUPERVISOR_RESTART_DELAY, String.valueOf(DEFAULT_RESTART_DELAY_MS)));
	}

	public Path getRuntimeDir() {
		return Paths.get(getProperty(CraneParams.RUNTIME_DIR, DEFAULT_RUNTIME_DIR));
	}

	public Path getCalibrationFile() {
		return Paths.get(getProperty(CraneParams.CALIBRATION_FILE, DEFAULT_CALIBRATION_FILE));
	}

	/**
	 * @return the camera id given on the command line or -1
	 */
	public int getCameraIdOverride() {
		return hasProperty(CraneParams.CAMERA_ID) ? getIntProperty(CraneParams.CAMERA_ID, "-1") : -1;
	}

	@Override
	public String toString() {
		return "CraneConfig"+prop;
	}

}
