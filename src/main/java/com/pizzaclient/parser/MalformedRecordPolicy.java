/*
 * Copyright 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.pizzaclient.parser;

/**
 * What to do with the rest of a batch once one of its records fails validation.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum MalformedRecordPolicy {
	/**
	 * Treat the remainder of the batch as untrustworthy: stop at the first malformed record and discard the section
	 * (for store lists, keep what was already produced and stop).
	 */
	ABORT_SECTION,
	/**
	 * Drop only the malformed record and keep going.
	 */
	SKIP_RECORD
}
