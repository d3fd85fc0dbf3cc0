package com.comino.cranepose.supervisor;

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
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.comino.cranepose.config.Circuit;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * PID records under the runtime directory, one file per circuit. Records are
 * written to a temporary file and renamed into place, so a reader sees
 * either the old or the new record. A missing record means "not running".
 */
public class PidRecordStore {

	private static final Logger logger = LoggerFactory.getLogger(PidRecordStore.class);

	private static final ObjectMapper MAPPER = new ObjectMapper();

	private final Path runtime_dir;

	public PidRecordStore(Path runtime_dir) {
		this.runtime_dir = runtime_dir;
	}

	public Path getPath(Circuit circuit) {
		return runtime_dir.resolve(circuit.getKey()+"_pose_supervisor.json");
	}

	public void write(Circuit circuit, PidRecord record) throws IOException {
		Files.createDirectories(runtime_dir);
		Path target = getPath(circuit);
		Path tmp    = Files.createTempFile(runtime_dir, target.getFileName().toString(), ".tmp");
		try {
			MAPPER.writeValue(tmp.toFile(), record);
			try {
				Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
			} catch(AtomicMoveNotSupportedException e) {
				Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
			}
		} finally {
			Files.deleteIfExists(tmp);
		}
	}

	/**
	 * @return the record, or empty if it is missing, unreadable or of an
	 *         unknown version
	 */
	public Optional<PidRecord> read(Circuit circuit) {
		Path path = getPath(circuit);
		if(!Files.exists(path))
			return Optional.empty();
		try {
			PidRecord record = MAPPER.readValue(path.toFile(), PidRecord.class);
			if(record.getVersion() != PidRecord.VERSION) {
				logger.warn("Ignoring PID record {} with version {}", path, record.getVersion());
				return Optional.empty();
			}
			return Optional.of(record);
		} catch(IOException e) {
			logger.warn("Ignoring unreadable PID record {}: {}", path, e.getMessage());
			return Optional.empty();
		}
	}

	public void delete(Circuit circuit) {
		try {
			Files.deleteIfExists(getPath(circuit));
		} catch(IOException e) {
			logger.warn("Deleting PID record of {} failed: {}", circuit, e.getMessage());
		}
	}

}
